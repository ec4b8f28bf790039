package com.astrazeneca.varfinder.modes;

import com.astrazeneca.varfinder.Configuration;
import com.astrazeneca.varfinder.VarFinder;
import com.astrazeneca.varfinder.data.DocumentContext;
import com.astrazeneca.varfinder.data.SeqVariantData;
import com.astrazeneca.varfinder.data.scopedata.ReadOnlyScope;
import com.astrazeneca.varfinder.printers.VariantPrinter;

import java.io.OutputStream;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;

import static com.astrazeneca.varfinder.Utils.printExceptionAndContinue;

/**
 * Abstract Mode of VarFinder. Provides the not parallel and the parallel way of running the documents through
 * the pipeline.
 */
public abstract class AbstractMode {
    /**
     * CompletableFuture which used to trigger the executor that it was the last Future in the chain. After adding it,
     * the records will be printed.
     */
    final static CompletableFuture<OutputStream> LAST_SIGNAL_FUTURE = CompletableFuture.completedFuture(null);

    /**
     * Runs the pipeline of a document in the calling thread.
     */
    static final Executor CALLER_THREAD = Runnable::run;

    protected final List<DocumentContext> documents;
    protected final ReadOnlyScope scope;

    public AbstractMode(List<DocumentContext> documents, ReadOnlyScope scope) {
        this.documents = documents;
        this.scope = scope;
    }

    /**
     * Extracts and grounds the variants of one document. A failing document is reported and gives no records,
     * the run stops after {@link Configuration#MAX_EXCEPTION_COUNT} failures.
     * @param doc document to process
     * @param varFinder finder of the worker
     * @param executor current Executor for parallel/single mode
     * @return records of the document
     */
    public CompletableFuture<List<SeqVariantData>> pipeline(DocumentContext doc, VarFinder varFinder, Executor executor) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return varFinder.processDocument(doc);
            } catch (Exception exception) {
                printExceptionAndContinue(exception, "document", doc.docId, scope.conf);
                return Collections.<SeqVariantData>emptyList();
            }
        }, executor);
    }

    public abstract void notParallel();

    public void parallel() {
        createParallelMode().process();
    }

    protected abstract AbstractParallelMode createParallelMode();

    /**
     * Abstract class for parallel modes of VarFinder. Initializes executor, starts tasks and prints the records
     * in order of the documents. The tasks producer must be overriding in the childs.
     */
    protected abstract class AbstractParallelMode {
        static final int CAPACITY = 10;

        final ExecutorService executor = Executors.newFixedThreadPool(scope.conf.threads);
        final BlockingQueue<Future<OutputStream>> toPrint = new LinkedBlockingQueue<>(CAPACITY);

        void process() {
            executor.submit(() -> {
                try {
                    produceTasks();
                } catch (InterruptedException | ExecutionException e) {
                    throw new RuntimeException(e);
                }
            });
            try {
                while (true) {
                    Future<OutputStream> wrk = toPrint.take();
                    if (wrk == LAST_SIGNAL_FUTURE) {
                        break;
                    }
                    VariantPrinter variantPrinter = createPrinter();
                    variantPrinter.print(wrk.get());
                }
            } catch (InterruptedException | ExecutionException e) {
                throw new RuntimeException(e);
            }

            executor.shutdown();
        }

        abstract void produceTasks() throws InterruptedException, ExecutionException;
    }

    VariantPrinter createPrinter() {
        VariantPrinter variantPrinter = VariantPrinter.createPrinter(scope.printerTypeOut);
        variantPrinter.setDelimiter(scope.conf.delimiter);
        return variantPrinter;
    }

    /**
     * Print header to output with option -h.
     */
    public void printHeader() {
        if (scope.conf.printHeader) {
            createPrinter().printHeader();
        }
    }
}
