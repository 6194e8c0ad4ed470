package com.example.cliporganizer.infrastructure.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.cliporganizer.domain.enumtype.StorageType;
import com.example.cliporganizer.domain.model.CatalogEntry;
import com.example.cliporganizer.domain.model.CreateEntryResult;
import com.example.cliporganizer.domain.model.DeleteEntryResult;
import com.example.cliporganizer.infrastructure.persistence.entity.ClipEntity;
import com.example.cliporganizer.infrastructure.persistence.mapper.ClipMapper;
import java.util.List;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mybatis.spring.boot.test.autoconfigure.MybatisTest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.TestPropertySource;

@MybatisTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@TestPropertySource(properties = {
        "spring.datasource.url=jdbc:h2:mem:catalog;MODE=MySQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1",
        "spring.datasource.driver-class-name=org.h2.Driver",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "spring.sql.init.mode=always"
})
@Import(MyBatisCatalogStore.class)
class MyBatisCatalogStoreTest {

    @Autowired
    private MyBatisCatalogStore store;

    @Autowired
    private ClipMapper clipMapper;

    @Autowired
    private DataSource dataSource;

    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate = new JdbcTemplate(dataSource);
    }

    @Test
    void createdEntryShouldBeListedAsLocal() {
        CreateEntryResult created = store.createEntry("/lib/Trip.mp4", "/lib/trip.mp4", "Trip", 61);

        assertTrue(created.isCreated());
        List<CatalogEntry> entries = store.listLocalEntries();
        assertEquals(1, entries.size());
        CatalogEntry entry = entries.get(0);
        assertEquals(created.getId(), entry.getId());
        assertEquals(StorageType.LOCAL, entry.getStorageType());
        assertEquals("/lib/Trip.mp4", entry.getLocationString());
        assertEquals("Trip", entry.getTitle());
        assertEquals(Integer.valueOf(61), entry.getDurationSec());
    }

    @Test
    void sameLocationKeyShouldBeReportedAsDuplicate() {
        CreateEntryResult first = store.createEntry("/lib/a.mp4", "/lib/a.mp4", "a", 1);

        CreateEntryResult second = store.createEntry("/LIB/A.mp4", "/lib/a.mp4", "A", 1);

        assertTrue(second.isDuplicate());
        assertEquals(first.getId(), second.getConflictingId());
        assertEquals(1, store.listLocalEntries().size());
    }

    @Test
    void uniqueIndexShouldRejectRacingInsert() {
        store.createEntry("/lib/a.mp4", "/lib/a.mp4", "a", 1);
        ClipEntity racing = new ClipEntity();
        racing.setTitle("a");
        racing.setDescription("");
        racing.setStorageType(StorageType.LOCAL.name());
        racing.setLocationString("/lib/a.mp4");
        racing.setLocationKeyMd5(LocationKeyHash.of("/lib/a.mp4"));
        racing.setDurationSec(0);

        assertThrows(DuplicateKeyException.class, () -> clipMapper.insert(racing));
    }

    @Test
    void listShouldSkipOnlineClipsAndCarryTags() {
        Long local = store.createEntry("/lib/a.mp4", "/lib/a.mp4", "a", 1).getId();
        jdbcTemplate.update("INSERT INTO clip(title, description, storage_type, location_string, location_key_md5) "
                + "VALUES ('online', '', 'YOUTUBE', 'https://youtu.be/x', ?)", LocationKeyHash.of("https://youtu.be/x"));
        Long tagId = insertTag("genre", "travel");
        jdbcTemplate.update("INSERT INTO clip_tag(clip_id, tag_id) VALUES (?, ?)", local, tagId);

        List<CatalogEntry> entries = store.listLocalEntries();

        assertEquals(1, entries.size());
        assertEquals(1, entries.get(0).getTags().size());
        assertEquals("travel", entries.get(0).getTags().get(0).getValue());
        assertEquals("genre", entries.get(0).getTags().get(0).getCategory());
    }

    @Test
    void deleteShouldRemoveClipAndTagLinks() {
        Long id = store.createEntry("/lib/a.mp4", "/lib/a.mp4", "a", 1).getId();
        store.updateThumbnailPath(id, "thumbnails/" + id + ".jpg");
        jdbcTemplate.update("INSERT INTO clip_tag(clip_id, tag_id) VALUES (?, ?)", id, insertTag("people", "Sam"));

        DeleteEntryResult deleted = store.deleteEntry(id);

        assertTrue(deleted.isDeleted());
        assertEquals("thumbnails/" + id + ".jpg", deleted.getDeleted().getThumbnailPath());
        assertEquals(1, deleted.getDeleted().getTags().size());
        assertNull(store.findEntry(id));
        assertEquals(0, jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM clip_tag WHERE clip_id = ?", Integer.class, id).intValue());
    }

    @Test
    void deletingUnknownClipShouldReportNotFound() {
        DeleteEntryResult result = store.deleteEntry(12345L);

        assertFalse(result.isDeleted());
    }

    @Test
    void findShouldReturnStoredFields() {
        Long id = store.createEntry("/lib/b.webm", "/lib/b.webm", "b", 0).getId();

        CatalogEntry entry = store.findEntry(id);

        assertNotNull(entry);
        assertEquals("", entry.getDescription());
        assertTrue(entry.getTags().isEmpty());
        assertTrue(entry.isLocal());
    }

    private Long insertTag(String category, String value) {
        jdbcTemplate.update("INSERT INTO tag(category, tag_value) VALUES (?, ?)", category, value);
        return jdbcTemplate.queryForObject(
                "SELECT id FROM tag WHERE category = ? AND tag_value = ?", Long.class, category, value);
    }
}
