package com.vtb.posture.keywords;

import lombok.Builder;
import lombok.Value;

/**
 * Итог перезагрузки словаря. При неудаче действующий набор не меняется.
 */
@Value
@Builder
public class ReloadOutcome {
    boolean success;
    long activeVersion;
    int keywordCount;
    String source;
    String error;
}
