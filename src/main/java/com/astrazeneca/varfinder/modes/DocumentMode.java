package com.astrazeneca.varfinder.modes;

import com.astrazeneca.varfinder.VarFinder;
import com.astrazeneca.varfinder.data.DocumentContext;
import com.astrazeneca.varfinder.data.SeqVariantData;
import com.astrazeneca.varfinder.data.scopedata.ReadOnlyScope;
import com.astrazeneca.varfinder.printers.VariantPrinter;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;

/**
 * Mode processing the documents one by one, or in parallel with one worker per document. Records are printed
 * in document order in both cases.
 */
public class DocumentMode extends AbstractMode {

    public DocumentMode(List<DocumentContext> documents, ReadOnlyScope scope) {
        super(documents, scope);
        printHeader();
    }

    /**
     * In not parallel mode each document will be processed in sequence.
     */
    @Override
    public void notParallel() {
        VariantPrinter variantPrinter = createPrinter();
        VarFinder varFinder = new VarFinder(scope);
        for (DocumentContext doc : documents) {
            processDocumentInPipeline(doc, varFinder, variantPrinter);
        }
    }

    /**
     * In parallel mode workers are created for each document and are processed in parallel.
     */
    @Override
    protected AbstractParallelMode createParallelMode() {
        return new AbstractParallelMode() {
            @Override
            void produceTasks() throws InterruptedException {
                for (DocumentContext doc : documents) {
                    Future<OutputStream> submit = executor.submit(new DocumentWorker(doc));
                    toPrint.put(submit);
                }
                toPrint.put(LAST_SIGNAL_FUTURE);
            }
        };
    }

    /**
     * Worker of the parallel mode, processes one document and keeps its records.
     */
    private class DocumentWorker implements Callable<OutputStream> {
        private final DocumentContext doc;

        DocumentWorker(DocumentContext doc) {
            this.doc = doc;
        }

        @Override
        public OutputStream call() {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            PrintStream out = new PrintStream(baos);
            VariantPrinter variantPrinter = createPrinter();
            variantPrinter.setOut(out);
            processDocumentInPipeline(doc, new VarFinder(scope), variantPrinter);
            out.close();
            return baos;
        }
    }

    private void processDocumentInPipeline(DocumentContext doc, VarFinder varFinder, VariantPrinter out) {
        List<SeqVariantData> records = pipeline(doc, varFinder, CALLER_THREAD).join();
        out.print(records);
    }
}
