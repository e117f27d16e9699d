package com.structdesign.core.renderer.impl;

import com.structdesign.core.model.DesignCheck;
import com.structdesign.core.model.DesignResult;
import com.structdesign.core.renderer.RenderContext;
import com.structdesign.core.renderer.ResultRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renderer that prints a design summary to the console with optional ANSI color formatting.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "true")</li>
 *   <li>{@code console.showChecks} - Print every check ("true"/"false", default: "true")</li>
 * </ul>
 */
public class ConsoleResultRenderer implements ResultRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleResultRenderer.class);

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String SEPARATOR = "-".repeat(80);

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(List<DesignResult> results, RenderContext context) {
        boolean useColors = context.flag(RenderContext.CONSOLE_COLORS, true);
        boolean showChecks = context.flag(RenderContext.CONSOLE_SHOW_CHECKS, true);

        logger.info("Rendering {} design results to console (colors: {})", results.size(), useColors);

        long valid = results.stream().filter(DesignResult::valid).count();
        String bold = useColors ? ANSI_BOLD : "";
        String reset = useColors ? ANSI_RESET : "";
        System.out.println(bold + "Designed " + results.size() + " element(s): " + valid + " valid, "
            + (results.size() - valid) + " invalid" + reset);

        for (DesignResult result : results) {
            System.out.println(SEPARATOR);
            printResult(result, useColors, showChecks);
        }
        System.out.println(SEPARATOR);
    }

    private void printResult(DesignResult result, boolean useColors, boolean showChecks) {
        String verdictColor = useColors ? (result.valid() ? ANSI_GREEN : ANSI_RED) : "";
        String noteColor = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";

        String verdict = result.valid() ? "✓ VALID" : "✗ INVALID";
        System.out.println(result.id() + "  " + result.summary() + "  " + verdictColor + verdict + reset);

        if (showChecks) {
            for (Map.Entry<String, DesignCheck> entry : result.checks().asMap().entrySet()) {
                DesignCheck check = entry.getValue();
                String statusColor = useColors ? (check.passed() ? ANSI_GREEN : ANSI_RED) : "";
                System.out.println(String.format(Locale.ROOT, "  %-18s %12.2f %12.2f  ratio %6.2f  %s%s%s",
                    entry.getKey(), check.required(), check.provided(), check.ratio(),
                    statusColor, check.status().id(), reset));
            }
        }

        System.out.println(String.format(Locale.ROOT, "  cost: %s %,d (concrete %.3f m3, steel %.1f kg)",
            result.cost().currency(), result.cost().total(), result.cost().breakdown().volume(),
            result.cost().breakdown().steelWeight()));

        for (String note : result.notes()) {
            System.out.println(noteColor + "  note: " + note + reset);
        }
    }
}
