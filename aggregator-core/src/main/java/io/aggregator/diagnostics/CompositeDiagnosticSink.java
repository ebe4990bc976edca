package io.aggregator.diagnostics;

import java.util.List;

public class CompositeDiagnosticSink implements DiagnosticSink {
    private final List<DiagnosticSink> delegates;

    public CompositeDiagnosticSink(List<DiagnosticSink> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    public List<DiagnosticSink> delegates() { return delegates; }

    @Override
    public void accept(DiagnosticEvent event) {
        for (DiagnosticSink d : delegates) {
            d.accept(event);
        }
    }

    @Override
    public void close() {
        RuntimeException first = null;
        for (DiagnosticSink d : delegates) {
            try {
                d.close();
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
