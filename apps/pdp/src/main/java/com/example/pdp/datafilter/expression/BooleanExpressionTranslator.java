package com.example.pdp.datafilter.expression;

import com.example.pdp.datafilter.expression.Operand.BooleanExpression;
import com.example.pdp.datafilter.expression.Operand.Value;
import com.example.pdp.datafilter.expression.Operand.Variable;
import com.example.pdp.datafilter.rego.Expression;
import com.example.pdp.datafilter.rego.Query;
import com.example.pdp.datafilter.rego.QuerySet;
import com.example.pdp.datafilter.rego.Term;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Lowers a partially evaluated {@link QuerySet} into a {@link ResidualPolicy}.
 *
 * <p>The query set is a disjunction of conjunctions, so the resulting condition is an {@code or}
 * over each query's {@code and}. Single-element connectives are collapsed.</p>
 */
@Component
public class BooleanExpressionTranslator {

    @NonNull
    public ResidualPolicy translate(@NonNull QuerySet querySet) {
        if (querySet.isAlwaysFalse()) {
            return ResidualPolicy.alwaysDeny();
        }
        if (querySet.isAlwaysTrue()) {
            return ResidualPolicy.alwaysAllow();
        }

        List<BooleanExpression> disjuncts = querySet.queries().stream()
                .filter(q -> !q.isAlwaysTrue())
                .map(this::translateQuery)
                .toList();

        if (disjuncts.size() == 1) {
            return ResidualPolicy.conditional(disjuncts.get(0));
        }
        return ResidualPolicy.conditional(
                new BooleanExpression(BooleanExpression.OR, List.copyOf(disjuncts)));
    }

    private BooleanExpression translateQuery(Query query) {
        List<BooleanExpression> conjuncts = query.expressions().stream()
                .map(this::translateExpression)
                .toList();

        if (conjuncts.size() == 1) {
            return conjuncts.get(0);
        }
        return new BooleanExpression(BooleanExpression.AND, List.copyOf(conjuncts));
    }

    private BooleanExpression translateExpression(Expression expression) {
        if (expression.isCall()) {
            return translateCall((Term.CallTerm) expression.operator());
        }
        String operator = operatorName(expression.operator());
        List<Operand> operands = expression.operands().stream()
                .map(this::translateTerm)
                .toList();
        return new BooleanExpression(operator, operands);
    }

    private BooleanExpression translateCall(Term.CallTerm call) {
        List<Operand> arguments = call.arguments().stream()
                .map(this::translateTerm)
                .toList();
        return new BooleanExpression(BooleanExpression.CALL,
                List.of(new BooleanExpression(call.functionName(), arguments)));
    }

    private String operatorName(Term term) {
        if (term instanceof Term.RefTerm ref) {
            return ref.path();
        }
        if (term instanceof Term.VarTerm var) {
            return var.name();
        }
        throw new ResidualTranslationException(
                "Expression operator must be a reference, got: " + term.type().getTag());
    }

    private Operand translateTerm(Term term) {
        if (term instanceof Term.NullTerm) {
            return new Value(null);
        }
        if (term instanceof Term.BooleanTerm b) {
            return new Value(b.value());
        }
        if (term instanceof Term.NumberTerm n) {
            return new Value(n.value());
        }
        if (term instanceof Term.StringTerm s) {
            return new Value(s.value());
        }
        if (term instanceof Term.VarTerm var) {
            return new Variable(var.name());
        }
        if (term instanceof Term.RefTerm ref) {
            return new Variable(ref.path());
        }
        if (term instanceof Term.CallTerm call) {
            return translateCall(call);
        }
        throw new ResidualTranslationException("Unsupported term: " + term);
    }
}
