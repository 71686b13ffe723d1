package com.platform.gitops.pipeline;

import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.error.ReconciliationException;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bash-style variable substitution over manifest text.
 *
 * <p>Supported forms:
 * <ul>
 *   <li>{@code ${VAR}}</li>
 *   <li>{@code ${VAR:=default}}, used when VAR is unset or empty</li>
 *   <li>{@code ${VAR:offset}} and {@code ${VAR:offset:length}}, substrings; a negative offset
 *       counts from the end and must follow a space, as in {@code ${VAR: -3}}</li>
 *   <li>{@code ${VAR/old/new}}, replaces the first occurrence of {@code old}</li>
 * </ul>
 * Any other {@code ${...}} expression is left as written. A supported expression whose variable
 * is unset and has no default is left as written too, unless strict mode is on.
 */
@Component
public class VariableSubstitutor {
    
    public static final Pattern VARIABLE_NAME = Pattern.compile("[_a-zA-Z][_a-zA-Z0-9]*");
    
    private static final Pattern EXPRESSION = Pattern.compile("\\$\\{([^{}]*)}");
    private static final Pattern DEFAULT_FORM = Pattern.compile(":=(.*)", Pattern.DOTALL);
    private static final Pattern SUBSTRING_FORM = Pattern.compile(":(?:\\s*(\\d+)|\\s+(-\\d+))(?::(\\d+))?");
    private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
    private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final Pattern REPLACE_FORM = Pattern.compile("/([^/]+)/(.*)", Pattern.DOTALL);
    
    /**
     * Checks that every variable name is well formed.
     *
     * @throws ReconciliationException with SUBSTITUTION_FAILED naming the first invalid name
     */
    public void validateNames(Map<String, String> variables) {
        for (String name : variables.keySet()) {
            if (!VARIABLE_NAME.matcher(name).matches()) {
                throw new ReconciliationException(ErrorCode.SUBSTITUTION_FAILED, String.format(
                    "'%s' var name is invalid, must match '%s'", name, VARIABLE_NAME.pattern()));
            }
        }
    }
    
    /**
     * @throws ReconciliationException with SUBSTITUTION_FAILED when {@code strict} and a variable
     *         has neither a value nor a default
     */
    public String substitute(String text, Map<String, String> variables, boolean strict) {
        Matcher matcher = EXPRESSION.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            String replacement = evaluate(matcher.group(0), matcher.group(1), variables, strict);
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
    
    private String evaluate(String expression, String body, Map<String, String> variables, boolean strict) {
        Matcher name = VARIABLE_NAME.matcher(body);
        if (!name.lookingAt()) {
            return expression;
        }
        String variable = name.group();
        String operator = body.substring(name.end());
        String value = variables.get(variable);
        
        if (operator.isEmpty()) {
            return value != null ? value : unresolved(expression, variable, strict);
        }
        
        Matcher defaultForm = DEFAULT_FORM.matcher(operator);
        if (defaultForm.matches()) {
            return value == null || value.isEmpty() ? defaultForm.group(1) : value;
        }
        
        Matcher substringForm = SUBSTRING_FORM.matcher(operator);
        if (substringForm.matches()) {
            if (value == null) {
                return unresolved(expression, variable, strict);
            }
            long offset = clamp(substringForm.group(1) != null ? substringForm.group(1) : substringForm.group(2));
            int start = (int) (offset < 0 ? Math.max(0, value.length() + offset) : Math.min(offset, value.length()));
            int end = value.length();
            if (substringForm.group(3) != null) {
                end = (int) Math.min(end, start + clamp(substringForm.group(3)));
            }
            return value.substring(start, end);
        }
        
        Matcher replaceForm = REPLACE_FORM.matcher(operator);
        if (replaceForm.matches()) {
            if (value == null) {
                return unresolved(expression, variable, strict);
            }
            return value.replaceFirst(Pattern.quote(replaceForm.group(1)), Matcher.quoteReplacement(replaceForm.group(2)));
        }
        
        return expression;
    }
    
    private static long clamp(String digits) {
        return new BigInteger(digits).min(INT_MAX).max(INT_MIN).longValue();
    }
    
    private static String unresolved(String expression, String variable, boolean strict) {
        if (strict) {
            throw new ReconciliationException(ErrorCode.SUBSTITUTION_FAILED,
                String.format("variable not set (strict mode): %s", variable));
        }
        return expression;
    }
}
