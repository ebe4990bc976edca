package io.aggregator.employee;

import io.aggregator.core.AggregationResult;
import io.aggregator.core.AmountRecord;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EmployeeReportTest {
    @Test
    void renders_departments_in_first_seen_order() {
        Map<String, BigDecimal> averages = new LinkedHashMap<>();
        averages.put("Sales", new BigDecimal("81000.00"));
        averages.put("Engineering", new BigDecimal("92500.00"));
        var result = new AggregationResult(new BigDecimal("347000.00"),
                new AmountRecord(3, "Charlie", "Engineering", 95000), averages, 4, 0);

        String text = EmployeeReport.format("in.csv", result);
        assertTrue(text.startsWith("Employee salary report: in.csv"));
        assertTrue(text.indexOf("Sales") < text.indexOf("Engineering  "));
        assertTrue(text.contains("347000.00"));
    }

    @Test
    void renders_missing_top_record() {
        var result = new AggregationResult(new BigDecimal("0.00"), null, Map.of(), 0, 3);
        String text = EmployeeReport.format("in.csv", result);
        assertTrue(text.contains("n/a"));
        assertTrue(text.contains("(none)"));
        assertTrue(text.contains("Rows: 0 valid, 3 skipped"));
    }
}
