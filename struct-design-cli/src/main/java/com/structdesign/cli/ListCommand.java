package com.structdesign.cli;

import com.structdesign.core.design.BarCatalog;
import com.structdesign.core.model.BarSize;
import com.structdesign.core.renderer.ResultRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list the bar catalog or the available renderers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List standard bar sizes
 * structdesign list bars
 *
 * # List renderers discovered via SPI
 * structdesign list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List standard bar sizes or available renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: bars or renderers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "bars", "bar" -> listBars();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: bars or renderers", type);
                yield 1;
            }
        };
    }

    private int listBars() {
        System.out.println("Standard Bars:");
        System.out.println();

        for (BarSize bar : BarCatalog.bars()) {
            System.out.printf(Locale.ROOT, "  • D%-3d area %6.1f mm2   %5.3f kg/m%n",
                bar.diameter(), bar.area(), bar.unitWeight());
        }
        System.out.println();
        System.out.println("Stirrup diameters: " + BarCatalog.stirrupDiameters());

        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        boolean found = false;
        for (ResultRenderer renderer : ServiceLoader.load(ResultRenderer.class)) {
            found = true;
            System.out.printf("  • %s (%s)%n", renderer.getId(), renderer.getClass().getSimpleName());
        }

        if (!found) {
            System.out.println("  No renderers found.");
        }

        return 0;
    }
}
