package com.questrail.sensorlog.report;

import com.questrail.sensorlog.api.DeviceSummary;

/**
 * Renders a {@link DeviceSummary} for people.
 *
 * <p>The rendering is a presentation concern, not a wire contract. Any
 * implementation must list faulty sensors with their reason and healthy
 * sensors by descending occurrence count.</p>
 */
@FunctionalInterface
public interface ReportFormatter
{
    String format(DeviceSummary summary);
}
