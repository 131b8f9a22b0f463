package org.abstractica.turnsync.impl.serialization;

import org.abstractica.turnsync.state.StateValue;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * The range of numbers a state tree may hold.
 *
 * <p>Canonical JSON writes numbers in plain notation, so the length of the
 * written text follows the exponent, not the length of the input. A number
 * is accepted when, without trailing zeros, it has at most
 * {@value #MAX_INTEGER_DIGITS} digits before and {@value #MAX_FRACTION_DIGITS}
 * digits after the decimal point.</p>
 */
public final class NumberLimits
{
    public static final int MAX_INTEGER_DIGITS = 1000;
    public static final int MAX_FRACTION_DIGITS = 1000;

    private NumberLimits()
    {
    }

    public static boolean isWithinLimits(BigDecimal value)
    {
        if (value.signum() == 0)
        {
            return true;
        }
        BigDecimal stripped = value.stripTrailingZeros();
        long fractionDigits = stripped.scale();
        long integerDigits = (long) stripped.precision() - stripped.scale();
        return fractionDigits <= MAX_FRACTION_DIGITS && integerDigits <= MAX_INTEGER_DIGITS;
    }

    /**
     * Finds the first number in a tree that is out of range.
     *
     * @param value the tree
     * @return the offending number, or empty if every number is in range
     */
    public static Optional<BigDecimal> findOutOfRange(StateValue value)
    {
        if (value instanceof StateValue.NumberValue number)
        {
            return isWithinLimits(number.value()) ? Optional.empty() : Optional.of(number.value());
        }
        if (value instanceof StateValue.ObjectValue object)
        {
            for (StateValue child : object.entries().values())
            {
                Optional<BigDecimal> found = findOutOfRange(child);
                if (found.isPresent())
                {
                    return found;
                }
            }
        }
        else if (value instanceof StateValue.ArrayValue array)
        {
            for (StateValue element : array.elements())
            {
                Optional<BigDecimal> found = findOutOfRange(element);
                if (found.isPresent())
                {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    public static String describe(BigDecimal value)
    {
        return "Number " + value + " is outside the supported range (at most " + MAX_INTEGER_DIGITS
                + " integer and " + MAX_FRACTION_DIGITS + " fraction digits)";
    }
}
