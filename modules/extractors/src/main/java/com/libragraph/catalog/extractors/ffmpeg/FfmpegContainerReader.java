package com.libragraph.catalog.extractors.ffmpeg;

import com.libragraph.catalog.extractors.api.DecodeException;
import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.FrameGrabber;
import org.jboss.logging.Logger;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens media files with FFmpeg (through JavaCV) and reports their
 * container-level tags and duration. No frames are decoded.
 */
public final class FfmpegContainerReader {

    private static final Logger log = Logger.getLogger(FfmpegContainerReader.class);

    private FfmpegContainerReader() {
    }

    /**
     * Loads the FFmpeg native libraries. False when they are missing for
     * this platform or fail to link.
     */
    public static boolean isAvailable() {
        try {
            FFmpegFrameGrabber.tryLoad();
            // corrupt input is reported through DecodeException, not stderr
            avutil.av_log_set_level(avutil.AV_LOG_ERROR);
            return true;
        } catch (Exception | LinkageError e) {
            log.debugf("FFmpeg native libraries not loaded: %s", e.toString());
            return false;
        }
    }

    /**
     * @throws DecodeException if the file is missing or FFmpeg cannot open it
     */
    public static FfmpegContainer read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new DecodeException("No such file: " + path);
        }
        try (FFmpegFrameGrabber grabber = new FFmpegFrameGrabber(path.toFile())) {
            grabber.start();
            long micros = grabber.getLengthInTime();
            return new FfmpegContainer(
                    grabber.getFormat(),
                    grabber.getMetadata(),
                    micros > 0 ? micros / 1_000_000.0 : null,
                    grabber.hasVideo() ? grabber.getVideoCodecName() : null,
                    grabber.hasAudio() ? grabber.getAudioCodecName() : null);
        } catch (FrameGrabber.Exception e) {
            throw new DecodeException("FFmpeg could not open " + path, e);
        }
    }
}
