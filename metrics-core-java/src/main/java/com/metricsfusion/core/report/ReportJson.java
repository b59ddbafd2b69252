package com.metricsfusion.core.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.metricsfusion.core.model.MetricsNode;

/** The one Gson configuration used to read and write reports. */
public final class ReportJson {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .registerTypeAdapter(MetricsNode.class, new MetricsNodeAdapter())
            .create();

    private ReportJson() {}

    public static Gson gson() {
        return GSON;
    }
}
