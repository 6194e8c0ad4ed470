package com.example.cliporganizer.infrastructure.media;

import com.example.cliporganizer.common.config.AppSyncProperties;
import com.example.cliporganizer.common.util.LogSanitizer;
import com.example.cliporganizer.domain.model.ProbeResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class FfprobeVideoMetadataProbe implements VideoMetadataProbe {

    private static final Logger log = LoggerFactory.getLogger(FfprobeVideoMetadataProbe.class);

    private final FfmpegBinaries ffmpegBinaries;
    private final AppSyncProperties appSyncProperties;
    private final ObjectMapper objectMapper;

    public FfprobeVideoMetadataProbe(FfmpegBinaries ffmpegBinaries,
                                     AppSyncProperties appSyncProperties,
                                     ObjectMapper objectMapper) {
        this.ffmpegBinaries = ffmpegBinaries;
        this.appSyncProperties = appSyncProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public ProbeResult probe(Path videoFile) {
        String fallbackTitle = VideoMetadataProbe.defaultTitle(videoFile);
        List<String> command = Arrays.asList(
                ffmpegBinaries.ffprobe(),
                "-v", "error",
                "-show_entries", "format=duration:format_tags=title",
                "-of", "json",
                videoFile.toString());
        ProcessRunner.Result result = ProcessRunner.run(command, appSyncProperties.getProbeTimeoutSec());
        if (!result.isSuccess()) {
            return ProbeResult.failure(fallbackTitle, "ffprobe failed: " + result.getFailureReason());
        }
        try {
            return parse(result.getOutput(), fallbackTitle);
        } catch (IOException e) {
            log.debug("ffprobe output not parseable, path={}", LogSanitizer.sanitizePath(videoFile.toString()), e);
            return ProbeResult.failure(fallbackTitle, "ffprobe output could not be parsed: " + e.getMessage());
        }
    }

    ProbeResult parse(String json, String fallbackTitle) throws IOException {
        JsonNode format = objectMapper.readTree(json).path("format");
        String title = format.path("tags").path("title").asText(null);
        if (!StringUtils.hasText(title)) {
            title = fallbackTitle;
        }
        JsonNode duration = format.path("duration");
        if (duration.isMissingNode() || !StringUtils.hasText(duration.asText())) {
            return ProbeResult.failure(title.trim(), "ffprobe reported no duration");
        }
        double seconds;
        try {
            seconds = Double.parseDouble(duration.asText());
        } catch (NumberFormatException e) {
            return ProbeResult.failure(title.trim(), "ffprobe reported an invalid duration: " + duration.asText());
        }
        return ProbeResult.success(title.trim(), (int) Math.round(seconds));
    }
}
