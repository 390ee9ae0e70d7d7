package de.julielab.jules.ae.placemapping;

import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.julielab.jules.ae.placemapping.textmodel.DocumentMappingResult;
import de.julielab.jules.ae.placemapping.textmodel.PlaceDocument;
import de.julielab.jules.ae.placemapping.utils.PlaceMappingException;

/**
 * <p>
 * Runs a list of documents through a {@link PlaceMapping} with a fixed number
 * of worker threads. Every document is committed to the {@link ResultSink} as
 * a whole right after it has been mapped.
 * </p>
 * <p>
 * A document whose mapping or commit fails is counted as failed and the run
 * continues. {@link #cancel()} stops the run between documents: documents
 * already being mapped are finished and committed, the remaining ones are
 * skipped.
 * </p>
 */
public class BatchPlaceMapping {
    private static final Logger log = LoggerFactory.getLogger(BatchPlaceMapping.class);

    private final PlaceMapping mapping;
    private final ResultSink sink;
    private final int workers;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public BatchPlaceMapping(PlaceMapping mapping, ResultSink sink) {
        this(mapping, sink, mapping.getConfiguration().getInt(PlaceMappingConfiguration.BATCH_WORKERS, 4));
    }

    public BatchPlaceMapping(PlaceMapping mapping, ResultSink sink, int workers) {
        if (workers < 1)
            throw new IllegalArgumentException("The number of batch workers must be positive but was " + workers);
        this.mapping = mapping;
        this.sink = sink;
        this.workers = workers;
    }

    /**
     * Requests the termination of the running batch. Documents that are
     * currently mapped are still committed. The request is cleared when the next
     * run starts.
     */
    public void cancel() {
        if (!cancelled.getAndSet(true))
            log.info("Cancellation of the batch run requested.");
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Maps and commits all documents. Returns when every document was committed,
     * has failed or was skipped due to cancellation.
     */
    public BatchStatistics run(List<PlaceDocument> documents) {
        cancelled.set(false);
        BatchStatistics statistics = new BatchStatistics();
        Iterator<PlaceDocument> documentIt = documents.iterator();
        AtomicInteger taken = new AtomicInteger();
        int threads = Math.min(workers, Math.max(1, documents.size()));
        log.info("Mapping {} documents with {} worker threads.", documents.size(), threads);

        ExecutorService executorService = Executors.newFixedThreadPool(threads);
        for (int i = 0; i < threads; i++) {
            executorService.submit(() -> {
                while (true) {
                    PlaceDocument document;
                    synchronized (documentIt) {
                        if (cancelled.get() || !documentIt.hasNext())
                            return;
                        document = documentIt.next();
                        taken.incrementAndGet();
                    }
                    process(document, statistics);
                }
            });
        }
        waitFinishAndShutdownExecutor(executorService);

        statistics.setCancelled(cancelled.get());
        statistics.setSkippedDocuments(documents.size() - taken.get());
        log.info("Batch run finished. {}", statistics);
        return statistics;
    }

    private void process(PlaceDocument document, BatchStatistics statistics) {
        DocumentMappingResult result;
        try {
            result = mapping.map(document);
        } catch (RuntimeException e) {
            log.error("Mapping of document {} failed, it is not committed.", document.getDocumentId(), e);
            statistics.recordFailed(document.getDocumentId(), e);
            return;
        }
        try {
            sink.commit(result);
        } catch (PlaceMappingException | RuntimeException e) {
            log.error("Could not commit the results of document {}.", document.getDocumentId(), e);
            statistics.recordFailed(document.getDocumentId(), e);
            return;
        }
        statistics.recordCommitted(result);
        log.debug("Committed {}", result);
    }

    private void waitFinishAndShutdownExecutor(ExecutorService executorService) {
        executorService.shutdown();
        try {
            while (!executorService.awaitTermination(1, TimeUnit.MINUTES))
                log.info("Waiting for the batch workers to finish.");
        } catch (InterruptedException e) {
            log.warn("The wait for the batch workers was interrupted, cancelling the run.");
            cancel();
            try {
                if (!executorService.awaitTermination(1, TimeUnit.MINUTES))
                    log.warn("Giving up waiting for the batch workers.");
            } catch (InterruptedException e1) {
                log.warn("Giving up waiting for the batch workers.");
            }
            Thread.currentThread().interrupt();
        } finally {
            executorService.shutdownNow();
        }
    }
}
