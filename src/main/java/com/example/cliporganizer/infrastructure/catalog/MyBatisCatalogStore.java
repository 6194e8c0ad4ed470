package com.example.cliporganizer.infrastructure.catalog;

import com.example.cliporganizer.common.exception.CatalogUnavailableException;
import com.example.cliporganizer.common.util.LogSanitizer;
import com.example.cliporganizer.domain.enumtype.StorageType;
import com.example.cliporganizer.domain.model.CatalogEntry;
import com.example.cliporganizer.domain.model.CatalogTag;
import com.example.cliporganizer.domain.model.CreateEntryResult;
import com.example.cliporganizer.domain.model.DeleteEntryResult;
import com.example.cliporganizer.infrastructure.persistence.entity.ClipEntity;
import com.example.cliporganizer.infrastructure.persistence.entity.ClipTagRow;
import com.example.cliporganizer.infrastructure.persistence.mapper.ClipMapper;
import com.example.cliporganizer.infrastructure.persistence.mapper.ClipTagMapper;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Catalog store backed by the clip tables.
 *
 * <p>Location uniqueness is keyed by the MD5 of the location key and checked before every insert;
 * a concurrent insert that slips past the check is caught by the unique index and reported the same way.
 */
@Component
public class MyBatisCatalogStore implements CatalogStore {

    private static final Logger log = LoggerFactory.getLogger(MyBatisCatalogStore.class);

    private final ClipMapper clipMapper;
    private final ClipTagMapper clipTagMapper;
    private final TransactionTemplate transactionTemplate;

    public MyBatisCatalogStore(ClipMapper clipMapper,
                               ClipTagMapper clipTagMapper,
                               PlatformTransactionManager transactionManager) {
        this.clipMapper = clipMapper;
        this.clipTagMapper = clipTagMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public List<CatalogEntry> listLocalEntries() {
        return guard("list local clips", () -> {
            String storageType = StorageType.LOCAL.name();
            List<ClipEntity> clips = clipMapper.selectByStorageType(storageType);
            Map<Long, List<CatalogTag>> tagsByClip = new HashMap<>();
            for (ClipTagRow row : clipTagMapper.selectByStorageType(storageType)) {
                tagsByClip.computeIfAbsent(row.getClipId(), key -> new ArrayList<>())
                        .add(new CatalogTag(row.getTagId(), row.getCategory(), row.getTagValue()));
            }
            List<CatalogEntry> entries = new ArrayList<>(clips.size());
            for (ClipEntity clip : clips) {
                entries.add(toEntry(clip, tagsByClip.get(clip.getId())));
            }
            return entries;
        });
    }

    @Override
    public CatalogEntry findEntry(Long id) {
        return guard("find clip", () -> {
            ClipEntity clip = clipMapper.selectById(id);
            if (clip == null) {
                return null;
            }
            return toEntry(clip, toTags(clipTagMapper.selectByClipId(id)));
        });
    }

    @Override
    public CreateEntryResult createEntry(String locationString, String locationKey, String title, int durationSec) {
        String locationKeyMd5 = LocationKeyHash.of(locationKey);
        return guard("create clip", () -> {
            Long existingId = clipMapper.selectIdByLocationKeyMd5(locationKeyMd5);
            if (existingId != null) {
                return CreateEntryResult.duplicate(existingId);
            }
            ClipEntity entity = new ClipEntity();
            entity.setTitle(LogSanitizer.truncate(title, 512));
            entity.setDescription("");
            entity.setStorageType(StorageType.LOCAL.name());
            entity.setLocationString(locationString);
            entity.setLocationKeyMd5(locationKeyMd5);
            entity.setDurationSec(durationSec);
            try {
                clipMapper.insert(entity);
            } catch (DuplicateKeyException e) {
                log.info("CATALOG_CREATE_RACE path={} reason={}",
                        LogSanitizer.sanitizePath(locationString), LogSanitizer.sanitize(e.getMessage()));
                return CreateEntryResult.duplicate(clipMapper.selectIdByLocationKeyMd5(locationKeyMd5));
            }
            return CreateEntryResult.created(entity.getId());
        });
    }

    @Override
    public void updateThumbnailPath(Long id, String thumbnailPath) {
        guard("update thumbnail path", () -> clipMapper.updateThumbnailPath(id, thumbnailPath));
    }

    @Override
    public DeleteEntryResult deleteEntry(Long id) {
        return guard("delete clip", () -> transactionTemplate.execute(status -> {
            ClipEntity clip = clipMapper.selectById(id);
            if (clip == null) {
                return DeleteEntryResult.notFound();
            }
            CatalogEntry entry = toEntry(clip, toTags(clipTagMapper.selectByClipId(id)));
            clipTagMapper.deleteByClipId(id);
            if (clipMapper.deleteById(id) == 0) {
                return DeleteEntryResult.notFound();
            }
            return DeleteEntryResult.deleted(entry);
        }));
    }

    private <T> T guard(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException | CannotCreateTransactionException e) {
            throw new CatalogUnavailableException("Catalog store unavailable during " + operation, e);
        }
    }

    private CatalogEntry toEntry(ClipEntity clip, List<CatalogTag> tags) {
        CatalogEntry entry = new CatalogEntry();
        entry.setId(clip.getId());
        entry.setStorageType(toStorageType(clip.getStorageType()));
        entry.setLocationString(clip.getLocationString());
        entry.setTitle(clip.getTitle());
        entry.setDescription(clip.getDescription());
        entry.setDurationSec(clip.getDurationSec());
        entry.setThumbnailPath(clip.getThumbnailPath());
        if (tags != null) {
            entry.setTags(tags);
        }
        return entry;
    }

    private List<CatalogTag> toTags(List<ClipTagRow> rows) {
        List<CatalogTag> tags = new ArrayList<>(rows.size());
        for (ClipTagRow row : rows) {
            tags.add(new CatalogTag(row.getTagId(), row.getCategory(), row.getTagValue()));
        }
        return tags;
    }

    private StorageType toStorageType(String value) {
        try {
            return StorageType.valueOf(value);
        } catch (IllegalArgumentException | NullPointerException e) {
            log.warn("Unknown storage type on clip row, value={}", LogSanitizer.sanitize(value));
            return null;
        }
    }
}
