package io.validrun.discovery;

import io.validrun.model.CaseManifest;
import io.validrun.model.ErrorCodes;
import io.validrun.model.Identity;
import io.validrun.model.PlanManifest;
import io.validrun.model.SuiteManifest;
import io.validrun.model.ValidationError;
import io.validrun.model.ValidationException;

import java.util.List;
import java.util.Map;

public record DiscoveryResult(
        Map<Identity, Discovered<CaseManifest>> cases,
        Map<Identity, Discovered<SuiteManifest>> suites,
        Map<Identity, Discovered<PlanManifest>> plans,
        List<ValidationError> errors,
        List<String> warnings
) {
    public DiscoveryResult {
        cases = Map.copyOf(cases);
        suites = Map.copyOf(suites);
        plans = Map.copyOf(plans);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public void throwIfErrors() {
        if (hasErrors()) {
            throw new ValidationException(errors);
        }
    }

    public Discovered<CaseManifest> requireCase(Identity identity) {
        return require(cases, identity, "testCase");
    }

    public Discovered<SuiteManifest> requireSuite(Identity identity) {
        return require(suites, identity, "suite");
    }

    public Discovered<PlanManifest> requirePlan(Identity identity) {
        return require(plans, identity, "plan");
    }

    private static <T> Discovered<T> require(Map<Identity, Discovered<T>> map, Identity identity, String kind) {
        Discovered<T> found = map.get(identity);
        if (found == null) {
            throw new ValidationException(ValidationError.of(
                    ErrorCodes.RUN_REQUEST_IDENTITY_NOT_FOUND,
                    "No " + kind + " found with identity " + identity,
                    "entityType", kind,
                    "identity", identity.toString()
            ));
        }
        return found;
    }
}
