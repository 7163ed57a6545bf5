package com.reportkit.cli.command;

import com.reportkit.core.calc.DefaultCalculationProvider;
import com.reportkit.report.Renderer;
import com.reportkit.report.RendererRegistry;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * List the available output formats.
 */
@Command(
        name = "formats",
        description = "List available report formats"
)
public class FormatsCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        RendererRegistry registry = RendererRegistry.withBuiltIns(new DefaultCalculationProvider());
        registry.loadServiceProviders();

        System.out.println();
        System.out.printf("%-10s %-10s %-18s %s%n", "FORMAT", "EXTENSION", "CONTENT TYPE", "FORMATTING");
        System.out.println("─".repeat(52));
        for (Renderer renderer : registry.getRenderers()) {
            System.out.printf("%-10s %-10s %-18s %s%n",
                    renderer.getName(),
                    renderer.getDefaultFileExtension(),
                    renderer.getContentType(),
                    renderer.supportsFormatting() ? "yes" : "no");
        }
        System.out.println();
        return 0;
    }
}
