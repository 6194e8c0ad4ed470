package com.example.cliporganizer.application.service;

import com.example.cliporganizer.common.config.AppSyncProperties;
import com.example.cliporganizer.common.exception.LocationKeyException;
import java.text.Normalizer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Locale;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns raw file paths and stored location strings into comparable keys.
 *
 * <p>The display form keeps the original case and only fixes separators, {@code .}/{@code ..}
 * segments, repeated and trailing slashes and Unicode composition. The location key is the
 * display form, case-folded when paths are configured as case-insensitive. The same instance is
 * used for scanned files and catalog rows so both sides always agree.
 */
@Component
public class PathNormalizer {

    private static final String UNC_PREFIX = "//";

    private final boolean caseInsensitive;

    @Autowired
    public PathNormalizer(AppSyncProperties appSyncProperties) {
        this(appSyncProperties.isCaseInsensitivePaths());
    }

    public PathNormalizer(boolean caseInsensitive) {
        this.caseInsensitive = caseInsensitive;
    }

    public String normalize(String rawPath) {
        String display = toDisplayPath(rawPath);
        return caseInsensitive ? display.toLowerCase(Locale.ROOT) : display;
    }

    public String toDisplayPath(String rawPath) {
        if (rawPath == null) {
            throw new LocationKeyException(null, "Path is null");
        }
        String value = rawPath.trim();
        if (value.isEmpty()) {
            throw new LocationKeyException(rawPath, "Path is empty");
        }
        if (value.indexOf('\0') >= 0) {
            throw new LocationKeyException(rawPath, "Path contains a NUL character");
        }
        value = Normalizer.normalize(value.replace('\\', '/'), Normalizer.Form.NFC);

        String prefix = "";
        String rest = value;
        if (rest.startsWith(UNC_PREFIX) && !rest.startsWith("///")) {
            prefix = UNC_PREFIX;
            rest = rest.substring(2);
        } else if (rest.length() >= 2 && Character.isLetter(rest.charAt(0)) && rest.charAt(1) == ':') {
            prefix = Character.toUpperCase(rest.charAt(0)) + ":/";
            rest = rest.substring(2);
        } else if (rest.startsWith("/")) {
            prefix = "/";
        }
        boolean rooted = !prefix.isEmpty();

        Deque<String> segments = new ArrayDeque<>();
        for (String segment : rest.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (!segments.isEmpty() && !"..".equals(segments.peekLast())) {
                    segments.removeLast();
                } else if (!rooted) {
                    segments.addLast(segment);
                }
                continue;
            }
            segments.addLast(segment);
        }

        if (UNC_PREFIX.equals(prefix) && segments.size() < 2) {
            throw new LocationKeyException(rawPath, "UNC path needs a server and a share name");
        }
        if (segments.isEmpty()) {
            if (rooted) {
                return prefix;
            }
            throw new LocationKeyException(rawPath, "Path has no file or directory name");
        }

        StringBuilder sb = new StringBuilder(prefix);
        Iterator<String> it = segments.iterator();
        while (it.hasNext()) {
            sb.append(it.next());
            if (it.hasNext()) {
                sb.append('/');
            }
        }
        return sb.toString();
    }

    /**
     * Whether {@code locationKey} lies strictly below the directory whose key is {@code rootKey}.
     */
    public boolean isUnder(String locationKey, String rootKey) {
        String prefix = rootKey.endsWith("/") ? rootKey : rootKey + "/";
        return locationKey.length() > prefix.length() && locationKey.startsWith(prefix);
    }

    public boolean isCaseInsensitive() {
        return caseInsensitive;
    }
}
