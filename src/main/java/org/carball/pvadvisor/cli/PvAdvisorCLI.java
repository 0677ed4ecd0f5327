package org.carball.pvadvisor.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.pvadvisor.ai.AIAnalysisGateway;
import org.carball.pvadvisor.analyzer.RecommendationAssembler;
import org.carball.pvadvisor.config.AdvisorConfig;
import org.carball.pvadvisor.config.ConfigurationLoader;
import org.carball.pvadvisor.config.GatewayConfig;
import org.carball.pvadvisor.config.OutputFormat;
import org.carball.pvadvisor.model.analysis.SheetScore;
import org.carball.pvadvisor.model.recommendation.FilterSuggestion;
import org.carball.pvadvisor.model.recommendation.Recommendation;
import org.carball.pvadvisor.model.sheet.SheetExport;
import org.carball.pvadvisor.narrative.NarrativeTemplates;
import org.carball.pvadvisor.output.RecommendationReport;
import org.carball.pvadvisor.parser.SheetExportConnector;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Set;

@Slf4j
public class PvAdvisorCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║          PV Sheet Advisor - Report Field Recommender v%s     ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    // Options handled by ConfigurationLoader; the CLI only skips their values
    private static final Set<String> GATEWAY_OPTIONS = Set.of(
            "--gateway.endpoint", "--gateway.provider", "--gateway.model",
            "--gateway.temperature", "--gateway.max-tokens", "--gateway.timeout",
            "--api-key");

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            System.exit(args.length < 1 ? 1 : 0);
        }

        try {
            AdvisorConfig config = parseArgs(args);

            System.out.println("\n🔍 Starting analysis...");
            System.out.println("   Sheet export: " + config.getInputFile());
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output: " + baseFileName + ".json, " + baseFileName + ".md");
            } else {
                System.out.println("   Output: " + config.getOutputFile());
            }
            System.out.println("   AI analysis: " + (config.getGatewayConfig().isEnabled() ? "enabled" : "disabled"));
            if (config.isVerbose()) {
                System.out.println("   Gateway: " + config.getGatewayConfig().getConfigurationSummary());
                System.out.println("   Locale: " + config.getLocale());
            }
            System.out.println();

            // Step 1: Load sheets
            System.out.print("📄 Loading sheet export... ");
            SheetExport export = new SheetExportConnector(config.getInputFile()).load();
            System.out.println("✓");
            if (config.isVerbose()) {
                System.out.println("     - Sheets found: " + export.sheets().size());
            }

            // Step 2: Recommend
            System.out.print("🤖 Generating recommendation... ");
            RecommendationAssembler assembler = new RecommendationAssembler(
                    new AIAnalysisGateway(config.getGatewayConfig()),
                    NarrativeTemplates.forLanguage(config.getLocale()));
            Recommendation recommendation = assembler.recommend(export.sheets());
            System.out.println("✓");

            // Step 3: Output results
            System.out.print("📝 Writing results... ");
            outputResults(recommendation, export.sourceFile(), config);
            System.out.println("✓");

            printSummary(recommendation, config.isVerbose());

            System.out.println("\n✅ Analysis complete!");
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output files:");
                System.out.println("     - " + baseFileName + ".json");
                System.out.println("     - " + baseFileName + ".md");
            } else {
                System.out.println("   Output file: " + config.getOutputFile());
            }

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            System.exit(1);
        } catch (IllegalStateException e) {
            System.err.println("\n❌ Invalid sheet export: " + e.getMessage());
            log.debug("Format error details", e);
            System.exit(1);
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            System.exit(1);
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            System.exit(1);
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar pv-sheet-advisor.jar <sheets-export.json> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  sheets-export.json  JSON export of the workbook's sheets (name, headers, preview rows)");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file for the recommendation (default: recommendation.json)");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        System.out.println("  --locale, -l        Language of titles and descriptions: en|ko (default: en)");
        System.out.println("  --config, -c        YAML file with gateway settings (optional)");
        System.out.println("  --no-ai             Skip the AI gateway and use rule-based analysis only");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.print(ConfigurationLoader.getGatewayHelp());
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  # Basic analysis against a local gateway");
        System.out.println("  java -jar pv-sheet-advisor.jar plant-data.json");
        System.out.println();
        System.out.println("  # Korean narrative, markdown and JSON reports");
        System.out.println("  java -jar pv-sheet-advisor.jar plant-data.json --locale ko --format both");
        System.out.println();
        System.out.println("  # Rule-based only");
        System.out.println("  java -jar pv-sheet-advisor.jar plant-data.json --no-ai");
        System.out.println();
        System.out.println("  # OpenAI instead of the gateway");
        System.out.println("  java -jar pv-sheet-advisor.jar plant-data.json --gateway.provider openai --gateway.model gpt-4o-mini");
    }

    static AdvisorConfig parseArgs(String[] args) throws IOException {
        AdvisorConfig config = new AdvisorConfig();
        config.setInputFile(Paths.get(args[0]));

        // Set defaults
        config.setOutputFile("recommendation.json");
        config.setOutputFormat(OutputFormat.JSON);
        config.setLocale("en");
        config.setVerbose(false);

        Path configFile = null;
        boolean noAi = false;

        // Parse optional arguments
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--output", "-o" -> {
                    requireValue(args, i, "Output file not specified");
                    config.setOutputFile(args[++i]);
                }
                case "--format", "-f" -> {
                    requireValue(args, i, "Output format not specified");
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(args[++i].toUpperCase()));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                }
                case "--locale", "-l" -> {
                    requireValue(args, i, "Locale not specified");
                    config.setLocale(args[++i]);
                }
                case "--config", "-c" -> {
                    requireValue(args, i, "Configuration file not specified");
                    configFile = Paths.get(args[++i]);
                }
                case "--no-ai" -> noAi = true;
                case "--verbose", "-v" -> config.setVerbose(true);
                default -> {
                    if (!GATEWAY_OPTIONS.contains(arg)) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    requireValue(args, i, "Value for " + arg + " not specified");
                    // value is read by ConfigurationLoader
                    i++;
                }
            }
        }

        ConfigurationLoader loader = new ConfigurationLoader();
        GatewayConfig gatewayConfig = configFile != null
                ? loader.loadConfiguration(configFile, args)
                : loader.loadConfiguration(args);
        if (noAi) {
            gatewayConfig = gatewayConfig.toBuilder().enabled(false).build();
        }
        config.setGatewayConfig(gatewayConfig);

        // Apply correct file extension based on format
        String baseFileName = removeFileExtension(config.getOutputFile());
        if (config.getOutputFormat() == OutputFormat.MARKDOWN) {
            config.setOutputFile(baseFileName + ".md");
        } else {
            config.setOutputFile(baseFileName + ".json");
        }

        validateConfig(config);
        return config;
    }

    private static void requireValue(String[] args, int index, String message) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException(message);
        }
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void validateConfig(AdvisorConfig config) {
        if (!Files.exists(config.getInputFile())) {
            throw new IllegalArgumentException("Sheet export file not found: " + config.getInputFile());
        }

        if (!config.getInputFile().toString().endsWith(".json")) {
            throw new IllegalArgumentException("Sheet export must be a .json file");
        }

        Path outputDir = Paths.get(config.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    private static void outputResults(Recommendation recommendation, String sourceFile,
                                      AdvisorConfig config) throws IOException {

        RecommendationReport report = new RecommendationReport(recommendation, sourceFile);
        String baseFileName = removeFileExtension(config.getOutputFile());

        if (config.getOutputFormat() == OutputFormat.JSON || config.getOutputFormat() == OutputFormat.BOTH) {
            String jsonFile = config.getOutputFormat() == OutputFormat.BOTH ?
                    baseFileName + ".json" : config.getOutputFile();
            Files.writeString(Paths.get(jsonFile), report.toJson());
        }

        if (config.getOutputFormat() == OutputFormat.MARKDOWN || config.getOutputFormat() == OutputFormat.BOTH) {
            String markdownFile = config.getOutputFormat() == OutputFormat.BOTH ?
                    baseFileName + ".md" : config.getOutputFile();
            Files.writeString(Paths.get(markdownFile), report.toMarkdown());
        }
    }

    private static void printSummary(Recommendation recommendation, boolean verbose) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 RECOMMENDATION SUMMARY");
        System.out.println("=".repeat(60));

        if (recommendation.isEmpty()) {
            System.out.println("\n💡 No sheets found in the export, nothing to recommend.");
            return;
        }

        System.out.println("\nSelected sheet: " + recommendation.getSelectedSheet());
        System.out.printf("Confidence: %d%%%n", Math.round(recommendation.getConfidence() * 100));
        System.out.println("Source: " + recommendation.getSource());
        System.out.println("Title: " + recommendation.getTitle());

        System.out.println("\n🎯 Recommended fields:");
        recommendation.getRecommendedFields().forEach(field -> System.out.println("  - " + field));

        if (!recommendation.getSuggestedFilters().isEmpty()) {
            System.out.println("\n🔎 Suggested filters:");
            for (FilterSuggestion filter : recommendation.getSuggestedFilters()) {
                System.out.printf("  %-14s %s%n", filter.type().getWireName(), filter.column());
            }
        }

        if (verbose) {
            System.out.println("\nSheet scores:");
            for (SheetScore score : recommendation.getSheetScores()) {
                System.out.printf("  %-30s %d%n", score.sheetName(), score.score());
            }
        }
    }
}
