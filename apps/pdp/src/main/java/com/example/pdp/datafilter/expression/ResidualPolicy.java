package com.example.pdp.datafilter.expression;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * A residual policy expressed independently of any target query language.
 * A condition is present exactly when the type is {@link ResidualPolicyType#CONDITIONAL}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResidualPolicy(
        ResidualPolicyType type,
        @Nullable Operand.BooleanExpression condition
) {
    public ResidualPolicy {
        if (type == null) {
            throw new IllegalArgumentException("Residual policy type is required");
        }
        if (type == ResidualPolicyType.CONDITIONAL && condition == null) {
            throw new IllegalArgumentException("Conditional residual policy requires a condition");
        }
        if (type != ResidualPolicyType.CONDITIONAL && condition != null) {
            throw new IllegalArgumentException("Only a conditional residual policy may carry a condition");
        }
    }

    @NonNull
    public static ResidualPolicy alwaysAllow() {
        return new ResidualPolicy(ResidualPolicyType.ALWAYS_ALLOW, null);
    }

    @NonNull
    public static ResidualPolicy alwaysDeny() {
        return new ResidualPolicy(ResidualPolicyType.ALWAYS_DENY, null);
    }

    @NonNull
    public static ResidualPolicy conditional(@NonNull Operand.BooleanExpression condition) {
        return new ResidualPolicy(ResidualPolicyType.CONDITIONAL, condition);
    }
}
