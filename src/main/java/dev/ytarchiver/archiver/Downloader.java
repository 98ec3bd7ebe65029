package dev.ytarchiver.archiver;

/** Fetches a single video to local storage */
public interface Downloader {

	/**
	 * Download the job's video to its output path, retrying as configured.
	 *
	 * @throws DownloadException if every attempt failed
	 * @throws InterruptedException if interrupted while waiting for the download
	 */
	void download(DownloadJob job) throws DownloadException, InterruptedException;

	/**
	 * Check the downloader is usable before the archiver starts.
	 *
	 * @throws ArchiverException if it is not
	 */
	default void verify() throws ArchiverException, InterruptedException {}
}
