package com.xapdoc.render;

import com.xapdoc.model.DefinitionTree;
import com.xapdoc.model.DefinitionValue;
import com.xapdoc.model.ScalarValue;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.StringJoiner;

/**
 * Response flag byte: {@code response_flags.bits} rendered into {@code !response_flags!}.
 *
 * <p>Bits {@code "0"} to {@code "7"} that are not defined are filled with a {@code "-"} placeholder; the
 * filled mapping is returned as the new source value so later layers build on it. The output is a table of
 * bit names from bit 7 down to bit 0, followed by one bullet per named bit in the same order.
 */
@Component
@Order(3)
public class ResponseFlagsRenderer implements SectionRenderer {

    public static final String SOURCE_KEY = "response_flags";
    public static final String SECTION_KEY = "!response_flags!";

    static final String BITS_KEY = "bits";
    static final String NAME_KEY = "name";
    static final String DESCRIPTION_KEY = "description";
    static final String PLACEHOLDER = "-";

    private static final int BIT_COUNT = 8;

    @Override
    public String sourceKey() {
        return SOURCE_KEY;
    }

    @Override
    public String sectionKey() {
        return SECTION_KEY;
    }

    @Override
    public RenderedSection render(DefinitionValue source) {
        if (!(source instanceof DefinitionTree flags)) {
            throw new SectionRenderException("'" + SOURCE_KEY + "' must be a mapping");
        }
        DefinitionTree bits = flags.findTree(BITS_KEY)
                .orElseThrow(() -> new SectionRenderException("'" + SOURCE_KEY + "." + BITS_KEY + "' must be a mapping"));

        DefinitionTree filled = fillDefaults(bits);

        StringJoiner header = new StringJoiner(" | ", "| ", " |");
        StringJoiner dividers = new StringJoiner("|", "|", "|");
        StringJoiner names = new StringJoiner(" | ", "| ", " |");
        StringBuilder bullets = new StringBuilder();

        for (int n = BIT_COUNT - 1; n >= 0; n--) {
            DefinitionTree bit = bitEntry(filled, n);
            String name = field(bit, n, NAME_KEY);
            header.add("Bit " + n);
            dividers.add("--");
            names.add(name);
            if (!PLACEHOLDER.equals(name)) {
                bullets.append("\n* `Bit ").append(n).append("`: ").append(field(bit, n, DESCRIPTION_KEY));
            }
        }

        String text = header + "\n" + dividers + "\n" + names + "\n" + bullets + "\n";
        return new RenderedSection(flags.with(BITS_KEY, filled), text);
    }

    private static DefinitionTree fillDefaults(DefinitionTree bits) {
        DefinitionTree.Builder builder = bits.toBuilder();
        for (int n = 0; n < BIT_COUNT; n++) {
            String key = String.valueOf(n);
            if (!builder.containsKey(key)) {
                builder.put(key, DefinitionTree.builder()
                        .put(NAME_KEY, ScalarValue.text(PLACEHOLDER))
                        .put(DESCRIPTION_KEY, ScalarValue.text(PLACEHOLDER))
                        .build());
            }
        }
        return builder.build();
    }

    private static DefinitionTree bitEntry(DefinitionTree bits, int n) {
        return bits.findTree(String.valueOf(n))
                .orElseThrow(() -> new SectionRenderException("Response flag bit " + n + " must be a mapping"));
    }

    private static String field(DefinitionTree bit, int n, String key) {
        DefinitionValue value = bit.get(key);
        if (!(value instanceof ScalarValue scalar)) {
            throw new SectionRenderException("Response flag bit " + n + " has no '" + key + "'");
        }
        return scalar.asText();
    }
}
