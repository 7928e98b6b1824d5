package io.validrun.runtime;

import io.validrun.model.ErrorCodes;
import io.validrun.model.Privilege;
import io.validrun.model.ValidationError;
import io.validrun.model.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Enforced once, on the root's rolled-up privilege, before any child starts.
 */
public final class PrivilegeChecker {
    private static final Logger log = LoggerFactory.getLogger(PrivilegeChecker.class);

    private PrivilegeChecker() {
    }

    /**
     * @return warnings for {@code AdminPreferred} nodes when not elevated
     * @throws ValidationException when something requires elevation that the process lacks
     */
    public static List<String> check(ExecutionTree tree, boolean elevated) {
        ExecutionTree.Node root = tree.root();
        if (elevated || root.effectivePrivilege() == Privilege.USER) {
            return List.of();
        }
        if (root.effectivePrivilege() == Privilege.ADMIN_REQUIRED) {
            List<String> offenders = new ArrayList<>();
            for (int i = 0; i < tree.size(); i++) {
                ExecutionTree.Node node = tree.node(i);
                if (node.kind() == ExecutionTree.Kind.CASE && node.ownPrivilege() == Privilege.ADMIN_REQUIRED) {
                    offenders.add(node.identity().toString());
                }
            }
            throw new ValidationException(ValidationError.of(
                    ErrorCodes.PRIVILEGE_REQUIRED,
                    root.identity() + " requires administrator privileges",
                    "target", root.identity().toString(),
                    "requiredBy", offenders
            ));
        }
        String warning = root.identity() + " prefers administrator privileges; running without elevation";
        log.warn(warning);
        return List.of(warning);
    }
}
