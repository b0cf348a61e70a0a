package com.questrail.sensorlog.report;

import com.questrail.sensorlog.api.DeviceSummary;
import com.questrail.sensorlog.api.FaultReason;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * PlainTextReportFormatter
 * -----------------------------------------------------------------------------
 * Console report layout:
 *
 * <pre>
 *   All big messages: 3
 *
 *   Successful big messages: 2
 *
 *   Failed big messages: 1
 *
 *   S3: Battery device error
 *
 *   Success messages count:
 *   S1: 4
 *   S2: 1
 * </pre>
 *
 * <p>Healthy sensors are sorted by descending count. The sort is stable, so
 * ties keep the summary's first-appearance order.</p>
 */
public final class PlainTextReportFormatter implements ReportFormatter
{
    private static final String NL = "\n";

    @Override
    public String format(DeviceSummary summary)
    {
        Objects.requireNonNull(summary, "summary");

        final StringBuilder out = new StringBuilder();
        out.append("All big messages: ").append(summary.totalDevices()).append(NL).append(NL);
        out.append("Successful big messages: ").append(summary.healthyCount()).append(NL).append(NL);
        out.append("Failed big messages: ").append(summary.faultyCount()).append(NL).append(NL);

        for (Map.Entry<String, FaultReason> faulty : summary.faultyDevices().entrySet()) {
            out.append(faulty.getKey()).append(": ").append(faulty.getValue().description()).append(NL);
        }

        out.append(NL).append("Success messages count:").append(NL);
        for (Map.Entry<String, Integer> healthy : byDescendingCount(summary.healthyDevices())) {
            out.append(healthy.getKey()).append(": ").append(healthy.getValue()).append(NL);
        }
        return out.toString();
    }

    static List<Map.Entry<String, Integer>> byDescendingCount(Map<String, Integer> healthyDevices)
    {
        final List<Map.Entry<String, Integer>> sorted = new ArrayList<>(healthyDevices.entrySet());
        // List.sort is stable.
        sorted.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));
        return sorted;
    }
}
