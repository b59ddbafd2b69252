package com.metricsfusion.adapter;

import com.metricsfusion.adapter.documents.ParsedDocumentReader;
import com.metricsfusion.adapter.documents.SuppressedSymbolsReader;
import com.metricsfusion.adapter.manifest.ManifestConfig;
import com.metricsfusion.adapter.manifest.ManifestReader;
import com.metricsfusion.core.AggregationRequest;
import com.metricsfusion.core.AggregationResult;
import com.metricsfusion.core.MetricsAggregator;
import com.metricsfusion.core.config.MetricResolver;
import com.metricsfusion.core.config.ThresholdsParser;
import com.metricsfusion.core.evaluate.ThresholdTable;
import com.metricsfusion.core.filter.AssemblyFilter;
import com.metricsfusion.core.filter.MemberFilter;
import com.metricsfusion.core.filter.MemberKindFilter;
import com.metricsfusion.core.filter.SymbolFilters;
import com.metricsfusion.core.filter.TypeFilter;
import com.metricsfusion.core.model.MetricIdentifier;
import com.metricsfusion.core.model.MetricsNode;
import com.metricsfusion.core.model.ParsedMetricsDocument;
import com.metricsfusion.core.model.SuppressedSymbol;
import com.metricsfusion.core.report.ReportLoader;
import com.metricsfusion.core.report.ReportWriter;
import com.metricsfusion.core.suppression.SuppressionBinder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar metrics-adapter-java.jar aggregate \
 *     --manifest <path-to-run.json> \
 *     --output   <output-dir> \
 *     [--baseline <previous-report.json>]
 */
public class AdapterMain {

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[metrics-fusion] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar metrics-adapter-java.jar aggregate " +
                               "--manifest <path> --output <dir> [--baseline <report.json>]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[metrics-fusion] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    /** Runs the command and returns the path of the written report. */
    static Path run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("aggregate")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        // Parse flags
        String manifestPath = null;
        String outputDir = null;
        String baselinePath = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--manifest" -> manifestPath = requireNext(args, i++, "--manifest");
                case "--output"   -> outputDir    = requireNext(args, i++, "--output");
                case "--baseline" -> baselinePath = requireNext(args, i++, "--baseline");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (manifestPath == null) throw new UsageException("--manifest is required");
        if (outputDir == null)    throw new UsageException("--output is required");

        Path manifest = Paths.get(manifestPath);
        Path output   = Paths.get(outputDir);

        // 1. Read manifest; relative paths in it are relative to its directory
        System.err.println("[metrics-fusion] Reading manifest: " + manifest);
        ManifestConfig config = new ManifestReader().read(manifest);
        Path baseDir = manifest.toAbsolutePath().getParent();

        // 2. Configuration, all validated before any document is merged
        MetricResolver resolver = new MetricResolver(metricAliases(config.getMetricAliases()));
        ThresholdsParser thresholdsParser = new ThresholdsParser(resolver);
        ThresholdTable thresholds = ThresholdTable
                .of(thresholdsParser.parse(readOptional(baseDir, config.getThresholds())))
                .withOverrides(thresholdsParser.parseOverrides(readOptional(baseDir, config.getThresholdOverrides())));
        SymbolFilters filters = filters(config);

        List<SuppressedSymbol> suppressed = config.getSuppressedSymbols() != null
                ? new SuppressedSymbolsReader().read(baseDir.resolve(config.getSuppressedSymbols()))
                : List.of();

        // CLI flag wins over the manifest
        String effectiveBaseline = baselinePath != null ? baselinePath : resolvedOrNull(baseDir, config.getBaseline());
        MetricsNode baseline = null;
        if (effectiveBaseline != null) {
            System.err.println("[metrics-fusion] Loading baseline: " + effectiveBaseline);
            baseline = new ReportLoader().loadBaseline(Paths.get(effectiveBaseline));
        }

        // 3. Read parsed documents
        List<Path> documentPaths = config.getDocuments().stream()
                .map(baseDir::resolve)
                .collect(Collectors.toList());
        System.err.println("[metrics-fusion] Reading " + documentPaths.size() + " documents");
        List<ParsedMetricsDocument> documents = new ParsedDocumentReader().readAll(documentPaths);

        // 4. Aggregate
        AggregationRequest request = AggregationRequest.of(documents)
                .withSolutionName(config.getSolutionName())
                .withFilters(filters)
                .withThresholds(thresholds)
                .withBaseline(baseline)
                .withSuppressedSymbols(suppressed);
        AggregationResult result = new MetricsAggregator(new SuppressionBinder(resolver), Clock.systemUTC())
                .aggregate(request);
        if (!result.warnings().isEmpty()) {
            System.err.println("[metrics-fusion] " + result.warnings().size() + " elements skipped, see warnings above");
        }

        // 5. Write
        System.err.println("[metrics-fusion] Writing output to: " + output);
        Path reportPath = new ReportWriter().write(result.report(), output);

        System.err.println("[metrics-fusion] Done.");
        return reportPath;
    }

    static SymbolFilters filters(ManifestConfig config) {
        return new SymbolFilters(
                MemberFilter.fromPatterns(config.getExcludedMembers(), config.isCaseSensitiveMemberPatterns()),
                TypeFilter.fromPatterns(config.getExcludedTypes()),
                AssemblyFilter.fromPatterns(config.getExcludedAssemblies()),
                new MemberKindFilter(config.isExcludeMethods(), config.isExcludeProperties(),
                        config.isExcludeFields(), config.isExcludeEvents()));
    }

    /** Manifest alias keys may themselves be ids or built-in aliases. */
    static Map<MetricIdentifier, List<String>> metricAliases(Map<String, List<String>> raw) {
        Map<MetricIdentifier, List<String>> result = new EnumMap<>(MetricIdentifier.class);
        raw.forEach((name, aliases) -> result.put(MetricResolver.builtIn().resolve(name), aliases));
        return result;
    }

    private static String readOptional(Path baseDir, String file) {
        if (file == null || file.isBlank()) {
            return null;
        }
        Path path = baseDir.resolve(file);
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ManifestReader.ManifestReadException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    private static String resolvedOrNull(Path baseDir, String file) {
        return file == null || file.isBlank() ? null : baseDir.resolve(file).toString();
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
