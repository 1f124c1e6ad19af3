package quest.gekko.salesboard.service.validation;

import java.math.BigDecimal;

/**
 * One broken percentage rule.
 *
 * @param field     the configuration field at fault, e.g. {@code weekly_distribution} or {@code role_weights[week=2]}
 * @param scope     the rows the sum was taken over
 * @param actualSum the offending sum, or null when the rule is not about a sum
 */
public record Violation(String field, String scope, BigDecimal actualSum, String message) {
}
