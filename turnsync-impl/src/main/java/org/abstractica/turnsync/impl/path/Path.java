package org.abstractica.turnsync.impl.path;

import org.abstractica.turnsync.error.ErrorCode;
import org.abstractica.turnsync.error.PathException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A parsed address into the state tree.
 *
 * <p>Grammar: an identifier followed by any number of {@code .identifier},
 * {@code [integer]} or {@code [*]} steps. Identifiers start with a letter or
 * underscore and continue with letters, digits or underscores.</p>
 *
 * @param steps the steps from the root, never empty for parsed paths
 */
public record Path(List<PathStep> steps)
{
    public Path
    {
        steps = List.copyOf(steps);
    }

    /**
     * Parses a path string.
     *
     * @param text the path, for example {@code inventory[2].charges}
     * @return the parsed path
     * @throws PathException with {@link ErrorCode#INVALID_PATH} on a syntax error
     */
    public static Path parse(String text)
    {
        Objects.requireNonNull(text, "text");
        List<PathStep> steps = new ArrayList<>();
        int pos = readIdentifier(text, 0, steps);
        while (pos < text.length())
        {
            char c = text.charAt(pos);
            if (c == '.')
            {
                pos = readIdentifier(text, pos + 1, steps);
            }
            else if (c == '[')
            {
                pos = readBracket(text, pos + 1, steps);
            }
            else
            {
                throw invalid(text, "unexpected '" + c + "' at " + pos);
            }
        }
        return new Path(steps);
    }

    public static Path of(PathStep... steps)
    {
        return new Path(List.of(steps));
    }

    public boolean isEmpty()
    {
        return steps.isEmpty();
    }

    public int size()
    {
        return steps.size();
    }

    public PathStep get(int i)
    {
        return steps.get(i);
    }

    public PathStep last()
    {
        if (steps.isEmpty())
        {
            throw new IllegalStateException("Empty path has no last step");
        }
        return steps.get(steps.size() - 1);
    }

    /**
     * Returns this path without its last step.
     *
     * @return the parent path
     */
    public Path parent()
    {
        if (steps.isEmpty())
        {
            throw new IllegalStateException("Empty path has no parent");
        }
        return new Path(steps.subList(0, steps.size() - 1));
    }

    /**
     * Returns this path followed by {@code other}.
     *
     * @param other the path to append
     * @return the combined path
     */
    public Path concat(Path other)
    {
        List<PathStep> combined = new ArrayList<>(steps);
        combined.addAll(other.steps);
        return new Path(combined);
    }

    public Path child(PathStep step)
    {
        List<PathStep> combined = new ArrayList<>(steps);
        combined.add(step);
        return new Path(combined);
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder();
        for (PathStep step : steps)
        {
            if (step instanceof PathStep.Key && sb.length() > 0)
            {
                sb.append('.');
            }
            sb.append(step);
        }
        return sb.toString();
    }

    // ========== Parsing ==========

    private static int readIdentifier(String text, int start, List<PathStep> steps)
    {
        if (start >= text.length() || !isIdentifierStart(text.charAt(start)))
        {
            throw invalid(text, "identifier expected at " + start);
        }
        int end = start + 1;
        while (end < text.length() && isIdentifierPart(text.charAt(end)))
        {
            end++;
        }
        steps.add(new PathStep.Key(text.substring(start, end)));
        return end;
    }

    private static int readBracket(String text, int start, List<PathStep> steps)
    {
        int close = text.indexOf(']', start);
        if (close < 0)
        {
            throw invalid(text, "missing ']' after " + (start - 1));
        }
        String content = text.substring(start, close);
        if (content.equals("*"))
        {
            steps.add(PathStep.Append.INSTANCE);
        }
        else
        {
            if (content.isEmpty() || content.length() > 9 || !content.chars().allMatch(Character::isDigit))
            {
                throw invalid(text, "bad index '" + content + "'");
            }
            steps.add(new PathStep.Index(Integer.parseInt(content)));
        }
        return close + 1;
    }

    private static boolean isIdentifierStart(char c)
    {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c)
    {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }

    private static PathException invalid(String text, String detail)
    {
        return new PathException(ErrorCode.INVALID_PATH, text, "Invalid path '" + text + "': " + detail);
    }
}
