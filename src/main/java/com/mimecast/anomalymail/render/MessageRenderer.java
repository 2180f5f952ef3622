package com.mimecast.anomalymail.render;

import com.mimecast.anomalymail.template.TemplatePair;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Message template renderer.
 *
 * <p>Expands <code>{name}</code> placeholders with named parameters.
 * <br>Templates and text parameters are trimmed before substitution.
 *
 * <p>Supported syntax:
 * <ul>
 *   <li><code>{name}</code> - parameter text.</li>
 *   <li><code>{name:.2f}</code> - numeric parameter in fixed point with two decimals.</li>
 *   <li><code>{{</code> and <code>}}</code> - literal braces.</li>
 * </ul>
 *
 * <p>Stateless and safe for concurrent use.
 */
public class MessageRenderer {

    /**
     * Fixed point format spec, like <i>.1f</i>.
     */
    private static final Pattern FIXED_SPEC = Pattern.compile("^\\.(\\d{1,2})f$");

    /**
     * Renders templates.
     *
     * @param templates  TemplatePair instance.
     * @param parameters Parameters map.
     * @return RenderedMessage instance.
     * @throws RenderException Placeholder without parameter or malformed template.
     */
    public RenderedMessage render(TemplatePair templates, Map<String, TemplateValue> parameters) throws RenderException {
        return new RenderedMessage(
                expand(templates.getSubject(), parameters),
                expand(templates.getContent(), parameters)
        );
    }

    /**
     * Expands a single template.
     *
     * @param template   Template string.
     * @param parameters Parameters map.
     * @return Expanded string.
     * @throws RenderException Placeholder without parameter or malformed template.
     */
    public String expand(String template, Map<String, TemplateValue> parameters) throws RenderException {
        String text = template.strip();
        StringBuilder out = new StringBuilder(text.length() + 64);

        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '{') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '{') {
                    out.append('{');
                    i += 2;
                    continue;
                }

                int end = text.indexOf('}', i + 1);
                if (end < 0) {
                    throw new RenderException(null, "single '{' encountered in template");
                }
                out.append(substitute(text.substring(i + 1, end), parameters));
                i = end + 1;

            } else if (c == '}') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '}') {
                    out.append('}');
                    i += 2;
                    continue;
                }
                throw new RenderException(null, "single '}' encountered in template");

            } else {
                out.append(c);
                i++;
            }
        }

        return out.toString();
    }

    /**
     * Resolves one placeholder field.
     *
     * @param field      Field text between braces.
     * @param parameters Parameters map.
     * @return Replacement string.
     * @throws RenderException Unknown parameter or unsupported spec.
     */
    private String substitute(String field, Map<String, TemplateValue> parameters) throws RenderException {
        String name = field;
        String spec = null;
        int colon = field.indexOf(':');
        if (colon >= 0) {
            name = field.substring(0, colon);
            spec = field.substring(colon + 1);
        }

        if (name.isEmpty()) {
            throw new RenderException(name, "empty placeholder name in template");
        }
        if (name.indexOf('{') >= 0) {
            throw new RenderException(name, "unexpected '{' in placeholder name");
        }

        TemplateValue value = parameters.get(name);
        if (value == null) {
            throw new RenderException(name, "missing parameter '" + name + "'");
        }

        if (spec == null || spec.isEmpty()) {
            return value.getType() == TemplateValue.Type.TEXT ? value.getText().strip() : value.getText();
        }

        Matcher matcher = FIXED_SPEC.matcher(spec);
        if (!matcher.matches()) {
            throw new RenderException(name, "unsupported format spec '" + spec + "' for parameter '" + name + "'");
        }
        if (value.getType() != TemplateValue.Type.NUMBER) {
            throw new RenderException(name, "format spec '" + spec + "' requires a numeric parameter '" + name + "'");
        }

        return formatFixed(value.getNumber().doubleValue(), Integer.parseInt(matcher.group(1)));
    }

    /**
     * Formats number in fixed point.
     * <p>Rounds the exact binary value half-even, so 0.8333 gives <i>0.8</i> and 0.25 gives <i>0.2</i>.
     *
     * @param value    Number.
     * @param decimals Decimal places.
     * @return Formatted string.
     */
    public static String formatFixed(double value, int decimals) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }

        return new BigDecimal(value).setScale(decimals, RoundingMode.HALF_EVEN).toPlainString();
    }
}
