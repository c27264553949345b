package com.menuassist.chat.service.analytics;

public interface AnalyticsRecorder {

    /**
     * Records a completed turn. Blocking; recording failures are logged and never propagated.
     */
    void record(AnalyticsEvent event);
}
