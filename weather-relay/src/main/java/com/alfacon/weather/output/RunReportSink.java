package com.alfacon.weather.output;

import com.alfacon.weather.model.RunSummary;

import java.io.IOException;

/**
 * Best-effort destination for a finished run. Nothing written here is read back by a run.
 */
public interface RunReportSink {

    void write(RunSummary summary) throws IOException;
}
