package org.ferry.diff;

import org.ferry.model.PolicyDescriptor;
import org.ferry.model.Snapshot;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Policy expressions are compared as printed by the server; equivalent expressions written differently count as changed.
 */
public class PolicyDiffer extends DescriptorDiffer<PolicyDescriptor> {

    @Override
    protected void declareFields(Map<String, Function<PolicyDescriptor, ?>> fields) {
        fields.put("command", PolicyDescriptor::getCommand);
        fields.put("roles", PolicyDescriptor::getRoles);
        fields.put("using", PolicyDescriptor::getUsingExpression);
        fields.put("check", PolicyDescriptor::getCheckExpression);
        fields.put("permissive", PolicyDescriptor::isPermissive);
    }

    @Override
    protected List<PolicyDescriptor> extract(Snapshot snapshot) {
        return snapshot.getPolicies();
    }

    @Override
    protected void store(SchemaDiff result, DiffResult<PolicyDescriptor> diff) {
        result.setPolicies(diff);
    }
}
