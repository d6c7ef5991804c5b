package com.apex.decisioncore.shadow;

import java.util.List;

public interface ShadowOutcomeListener {

    void onShadowOutcomes(ShadowIntent intent, List<ShadowOutcome> outcomes);
}
