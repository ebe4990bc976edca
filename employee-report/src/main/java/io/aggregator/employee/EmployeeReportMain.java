package io.aggregator.employee;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import io.aggregator.config.AggregatorConfig;
import io.aggregator.core.AggregationResult;
import io.aggregator.diagnostics.CollectingDiagnosticSink;
import io.aggregator.diagnostics.DiagnosticSink;
import io.aggregator.error.AggregationException;
import io.aggregator.module.AggregatorModule;
import io.aggregator.runtime.Aggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI that summarises an employee CSV ({@code ID,Name,Department,Salary}): total salary, highest paid
 * employee and average salary per department.
 */
@CommandLine.Command(name = "employee-report", mixinStandardHelpOptions = true, version = "employee-report 0.1.0",
        description = "Summarise salaries from an employee CSV file")
public final class EmployeeReportMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(EmployeeReportMain.class);

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "FILE",
            description = "Employee CSV with a header row; defaults to aggregator.input / AGGREGATOR_INPUT")
    Path input;

    @CommandLine.Option(names = {"-d", "--delimiter"}, description = "Field delimiter: a single character, tab, semicolon or pipe")
    String delimiter;

    @CommandLine.Option(names = "--charset", description = "Input charset (default UTF-8)")
    Charset charset;

    @CommandLine.Option(names = "--diagnostics", description = "Append diagnostics as JSON lines to this file")
    Path diagnostics;

    @CommandLine.Option(names = "--show-skipped", description = "List skipped rows after the report")
    boolean showSkipped;

    @CommandLine.Option(names = "--metrics", description = "Print run metrics after the report")
    boolean printMetrics;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int code = new CommandLine(new EmployeeReportMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        AggregatorConfig cfg = resolveConfig();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        CollectingDiagnosticSink skipped = new CollectingDiagnosticSink();
        DiagnosticSink[] extra = showSkipped ? new DiagnosticSink[]{skipped} : new DiagnosticSink[0];
        Injector injector = Guice.createInjector(new AggregatorModule(cfg, extra));

        try (DiagnosticSink ignored = injector.getInstance(DiagnosticSink.class)) {
            Aggregator aggregator = injector.getInstance(Aggregator.class);
            AggregationResult result = aggregator.aggregate(cfg.input().toString());
            out.print(EmployeeReport.format(cfg.input().toString(), result));
            if (showSkipped) out.print(EmployeeReport.formatSkipped(skipped.skipped()));
            if (printMetrics) out.print(EmployeeReport.formatMetrics(injector.getInstance(MetricRegistry.class)));
            return 0;
        } catch (AggregationException e) {
            log.debug("Aggregation of {} failed", e.location(), e);
            err.println("error: " + e.getMessage());
            return 1;
        } catch (ProvisionException e) {
            log.debug("Could not set up aggregation", e);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            err.println("error: could not set up aggregation: " + cause);
            return 1;
        } finally {
            out.flush();
            err.flush();
        }
    }

    private AggregatorConfig resolveConfig() {
        AggregatorConfig cfg;
        try {
            cfg = AggregatorConfig.fromEnv();
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid configuration: " + e.getMessage());
        }
        if (input != null) cfg = cfg.withInput(input);
        if (cfg.input() == null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Missing input FILE (or set AGGREGATOR_INPUT)");
        }
        if (delimiter != null) {
            try {
                cfg = cfg.withDelimiter(AggregatorConfig.parseDelimiter(delimiter));
            } catch (IllegalArgumentException e) {
                throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
            }
        }
        if (charset != null) cfg = cfg.withCharset(charset);
        if (diagnostics != null) cfg = cfg.withDiagnosticsFile(diagnostics);
        return cfg;
    }
}
