package dev.ytarchiver.archiver;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default implementation that runs downloads on a fixed number of long-lived worker threads.
 *
 * <p>Jobs go through a bounded queue with one slot per worker, so a producer stalls instead of
 * buffering an entire channel. Every worker hands exactly one list of failures to the result queue
 * when it exits, and {@link #awaitCompletion()} returns once it has collected one list per worker.
 */
public class DefaultDownloadManager implements DownloadManager {
	private static final Logger logger = LoggerFactory.getLogger(DefaultDownloadManager.class);
	private static final long POLL_MILLIS = 100;

	private final int threadCount;
	private final Downloader downloader;
	private final BlockingQueue<DownloadJob> downloadQueue;
	private final BlockingQueue<List<DownloadException>> results;
	private final ExecutorService executorService;
	private final AtomicInteger activeDownloads;
	private final AtomicInteger completedDownloads;
	private final AtomicInteger failedDownloads;
	private volatile boolean shutdownRequested;
	private volatile boolean cancelled;
	private boolean started;

	/**
	 * Create a new DefaultDownloadManager.
	 *
	 * @param threadCount Number of parallel download threads, also the queue capacity
	 * @param downloader The downloader each worker runs jobs with
	 */
	public DefaultDownloadManager(int threadCount, Downloader downloader) {
		if (threadCount < 1) {
			throw new IllegalArgumentException("threadCount must be at least 1: " + threadCount);
		}
		this.threadCount = threadCount;
		this.downloader = downloader;
		this.downloadQueue = new ArrayBlockingQueue<>(threadCount);
		this.results = new LinkedBlockingQueue<>();
		this.executorService = Executors.newFixedThreadPool(threadCount, workerThreadFactory());
		this.activeDownloads = new AtomicInteger(0);
		this.completedDownloads = new AtomicInteger(0);
		this.failedDownloads = new AtomicInteger(0);
	}

	/**
	 * Start the download worker threads. Should be called once after construction.
	 */
	@Override
	public synchronized void start() {
		if (started) {
			throw new IllegalStateException("DownloadManager already started");
		}
		if (cancelled) {
			throw new IllegalStateException("DownloadManager already cancelled");
		}
		started = true;
		logger.debug("Starting DownloadManager with {} threads", threadCount);
		for (int i = 0; i < threadCount; i++) {
			executorService.submit(this::downloadWorker);
		}
	}

	@Override
	public void submit(DownloadJob job) throws InterruptedException {
		while (true) {
			if (shutdownRequested) {
				throw new IllegalStateException("Cannot submit downloads after shutdown requested");
			}
			if (cancelled) {
				throw new CancellationException("Download manager cancelled, not queueing " + job.videoId());
			}
			if (downloadQueue.offer(job, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
				logger.debug("Queued download for {} [{}]", job.videoId(), job.channelId());
				return;
			}
		}
	}

	@Override
	public synchronized void shutdown() {
		if (shutdownRequested) {
			throw new IllegalStateException("DownloadManager already shut down");
		}
		logger.debug("Shutting down DownloadManager");
		shutdownRequested = true;
	}

	@Override
	public synchronized void cancel() {
		logger.info("Cancelling downloads, running ones will finish");
		cancelled = true;
		// Running workers finish their loop, then the threads exit without awaitCompletion
		executorService.shutdown();
	}

	@Override
	public List<DownloadException> awaitCompletion() throws InterruptedException {
		if (!shutdownRequested) {
			throw new IllegalStateException("awaitCompletion called before shutdown");
		}
		List<DownloadException> failures = new ArrayList<>();
		try {
			if (started) {
				for (int i = 0; i < threadCount; i++) {
					failures.addAll(results.take());
				}
			}
		} finally {
			executorService.shutdown();
		}
		executorService.awaitTermination(1, TimeUnit.MINUTES);

		// Jobs left behind by cancelled workers never ran
		DownloadJob leftover;
		while ((leftover = downloadQueue.poll()) != null) {
			failures.add(new DownloadException(leftover.videoId(), "cancelled before download started"));
		}
		return failures;
	}

	@Override
	public int getCompletedCount() {
		return completedDownloads.get();
	}

	@Override
	public int getFailedCount() {
		return failedDownloads.get();
	}

	/**
	 * Get the number of downloads currently in progress.
	 *
	 * @return Number of active downloads
	 */
	public int getActiveCount() {
		return activeDownloads.get();
	}

	/**
	 * Get the number of downloads waiting in the queue.
	 *
	 * @return Number of queued downloads
	 */
	public int getQueuedCount() {
		return downloadQueue.size();
	}

	/** Whether every worker thread has exited */
	boolean isTerminated() {
		return executorService.isTerminated();
	}

	/** Worker thread that processes downloads from the queue until it is closed and drained */
	private void downloadWorker() {
		List<DownloadException> failures = new ArrayList<>();
		try {
			while (!cancelled && (!shutdownRequested || !downloadQueue.isEmpty())) {
				DownloadJob job = downloadQueue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
				if (job == null) {
					continue;
				}
				if (cancelled) {
					failures.add(new DownloadException(job.videoId(), "cancelled before download started"));
					break;
				}
				activeDownloads.incrementAndGet();
				try {
					downloader.download(job);
					completedDownloads.incrementAndGet();
				} catch (DownloadException e) {
					failedDownloads.incrementAndGet();
					failures.add(e);
				} catch (InterruptedException e) {
					failedDownloads.incrementAndGet();
					failures.add(new DownloadException(job.videoId(), "interrupted", e));
					throw e;
				} catch (RuntimeException e) {
					failedDownloads.incrementAndGet();
					failures.add(new DownloadException(job.videoId(), "unexpected error: " + e.getMessage(), e));
				} finally {
					activeDownloads.decrementAndGet();
				}
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		} finally {
			results.add(failures);
		}
	}

	private static ThreadFactory workerThreadFactory() {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, "download-worker-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}
}
