package io.validrun.runner;

import io.validrun.reboot.RebootRequest;
import io.validrun.storage.CaseResult;

public record CaseRunOutcome(CaseResult result, RebootRequest rebootRequest) {
    public boolean suspended() {
        return rebootRequest != null;
    }
}
