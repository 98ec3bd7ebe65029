package dev.ytarchiver.archiver;

import java.util.List;

/**
 * Interface for managing parallel downloads of videos. Implementations receive jobs from the
 * archiver and run them on a fixed set of workers.
 */
public interface DownloadManager {
	/**
	 * Start the download manager. Should be called once after construction.
	 */
	void start();

	/**
	 * Submit a job for download. Blocks while the queue is full.
	 *
	 * @param job The video to download
	 * @throws IllegalStateException if called after {@link #shutdown()}
	 * @throws java.util.concurrent.CancellationException if the manager was cancelled
	 * @throws InterruptedException if interrupted while waiting for queue space
	 */
	void submit(DownloadJob job) throws InterruptedException;

	/**
	 * Signal that no more downloads will be submitted. Calling this twice is a programming error.
	 *
	 * @throws IllegalStateException if already shut down
	 */
	void shutdown();

	/**
	 * Ask the workers to stop after their current download. Running downloads are not interrupted,
	 * queued ones are never started. The workers are released even if {@link #awaitCompletion()} is
	 * never called.
	 */
	void cancel();

	/**
	 * Wait for every worker to finish. Must be called after {@link #shutdown()}, otherwise worker
	 * threads are leaked.
	 *
	 * @return The failures reported by all workers
	 * @throws InterruptedException if interrupted while waiting
	 */
	List<DownloadException> awaitCompletion() throws InterruptedException;

	/**
	 * Get the number of completed downloads.
	 *
	 * @return Number of successfully completed downloads
	 */
	int getCompletedCount();

	/**
	 * Get the number of failed downloads.
	 *
	 * @return Number of failed downloads
	 */
	int getFailedCount();
}
