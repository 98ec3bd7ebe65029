package dev.ytarchiver.archiver;

import java.nio.file.Path;

/**
 * A single unit of work for the download manager.
 *
 * @param videoId The video to download
 * @param channelId The channel owning the video
 * @param outputPath The output template handed to the downloader
 */
public record DownloadJob(String videoId, String channelId, Path outputPath) {}
