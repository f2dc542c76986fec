package com.weatherline.backend.recommendation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.weatherline.backend.model.AlertLevel;
import com.weatherline.backend.model.HoldReleaseFlag;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Production parameter recommendation. Immutable: each rule produces a new value via
 * {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(value = "rationaleText", allowGetters = true)
public class Recommendation {

    String siteId;

    // Fahrenheit
    double recommendedDryerTemp;

    // Seconds, relative to the current pre-mix time
    int preMixTimeDelta;

    HoldReleaseFlag holdReleaseFlag;

    AlertLevel alertLevel;

    double confidenceScore;

    @Singular("reason")
    List<String> rationale;

    Instant timestamp;

    boolean systemError;

    public String getRationaleText() {
        return String.join(" ", rationale);
    }

    public boolean isHold() {
        return holdReleaseFlag == HoldReleaseFlag.HOLD;
    }
}
