package com.sanguo.engine;

import com.sanguo.engine.card.CardCatalog;
import com.sanguo.engine.card.CardCatalogException;
import com.sanguo.engine.card.CardDefinition;
import com.sanguo.engine.config.ConfigurationException;
import com.sanguo.engine.config.EngineConfig;
import com.sanguo.engine.game.HeroCatalog;
import com.sanguo.engine.game.HeroDefinition;
import com.sanguo.engine.game.PlayerSpec;
import com.sanguo.engine.simulation.DuelResult;
import com.sanguo.engine.simulation.DuelSimulator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;

/**
 * Sanguo engine CLI - Main entry point.
 */
@Command(name = "sanguo-engine",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Rules engine and duel simulator for a Three Kingdoms card game",
        subcommands = {
                Main.SimulateCommand.class,
                Main.CardsCommand.class
        })
public class Main implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    // ========== SIMULATE COMMAND ==========
    @Command(name = "simulate", description = "Run seeded games between automatic players")
    static class SimulateCommand implements Callable<Integer> {
        @Option(names = {"-n", "--num-games"}, defaultValue = "100",
                description = "Number of games to simulate")
        int numGames;

        @Option(names = {"-p", "--players"}, split = ",",
                defaultValue = "cao_cao,lu_bu,xiahou_dun,zhou_yu",
                description = "Hero ids, one per seat; the first seat is the lord")
        List<String> heroIds;

        @Option(names = {"-s", "--seed"},
                description = "Random seed (optional)")
        Long seed;

        @Option(names = {"-v", "--verbose"},
                description = "Verbose output (single game log)")
        boolean verbose;

        @Option(names = {"-c", "--config"},
                description = "Path to an engine config JSON file (optional)")
        String configPath;

        @Option(names = {"--cards"},
                description = "Path to a card catalog JSON file (optional)")
        String cardsPath;

        @Override
        public Integer call() throws Exception {
            EngineConfig config;
            CardCatalog catalog;
            HeroCatalog heroes;
            try {
                config = configPath != null ? EngineConfig.fromFile(configPath)
                        : EngineConfig.fromResource(EngineConfig.DEFAULT_RESOURCE);
                catalog = loadCatalog(cardsPath);
                heroes = HeroCatalog.fromResource(HeroCatalog.DEFAULT_RESOURCE);
            } catch (ConfigurationException | CardCatalogException e) {
                System.err.println("✗ Failed to load: " + e.getMessage());
                return 1;
            }

            List<PlayerSpec> specs = new ArrayList<>();
            for (int seat = 0; seat < heroIds.size(); seat++) {
                specs.add(new PlayerSpec(seat, heroIds.get(seat), seat == 0));
            }

            System.out.println("\n=== Sanguo Duel Simulator ===\n");
            System.out.println("Players: " + String.join(", ", heroIds));
            System.out.println("Games: " + numGames);
            long baseSeed = seed != null ? seed : System.nanoTime();
            System.out.println("Seed: " + baseSeed);
            System.out.println();

            long startTime = System.currentTimeMillis();
            List<DuelResult> results = new ArrayList<>();
            try {
                for (int i = 0; i < numGames; i++) {
                    boolean verboseThisGame = verbose && i == 0;
                    results.add(DuelSimulator.runGame(specs, heroes, catalog, config, baseSeed + i, verboseThisGame));
                }
            } catch (CardCatalogException e) {
                System.err.println("✗ Failed to set up game: " + e.getMessage());
                return 1;
            }
            long elapsed = System.currentTimeMillis() - startTime;

            printResults(results, specs, numGames, elapsed);
            return 0;
        }
    }

    // ========== CARDS COMMAND ==========
    @Command(name = "cards", description = "List the card catalog and heroes")
    static class CardsCommand implements Callable<Integer> {
        @Option(names = {"--cards"},
                description = "Path to a card catalog JSON file (optional)")
        String cardsPath;

        @Override
        public Integer call() throws Exception {
            CardCatalog catalog;
            HeroCatalog heroes;
            try {
                catalog = loadCatalog(cardsPath);
                heroes = HeroCatalog.fromResource(HeroCatalog.DEFAULT_RESOURCE);
            } catch (CardCatalogException e) {
                System.err.println("✗ Failed to load cards: " + e.getMessage());
                return 1;
            }

            Map<String, Long> copies = new TreeMap<>();
            catalog.getDeckEntries().forEach(e -> copies.merge(e.definitionId(), 1L, Long::sum));

            System.out.println("=== Cards (" + catalog.getDeckEntries().size() + " in deck) ===\n");
            for (CardDefinition definition : catalog.getDefinitions()) {
                System.out.printf("  %-16s %-22s %-6s %-16s x%d%n", definition.id(), definition.name(),
                        definition.cardType().getJsonValue(), definition.subType().getJsonValue(),
                        copies.getOrDefault(definition.id(), 0L));
            }
            System.out.println("\n=== Heroes ===\n");
            for (HeroDefinition hero : heroes.getHeroes()) {
                System.out.printf("  %-12s %-12s %-4s hp %d  %s%n", hero.id(), hero.name(), hero.faction(),
                        hero.maxHealth(), String.join(", ", hero.abilities()));
            }
            return 0;
        }
    }

    // ========== HELPERS ==========

    private static CardCatalog loadCatalog(String path) throws CardCatalogException {
        return path != null ? CardCatalog.fromFile(path) : CardCatalog.fromResource(CardCatalog.DEFAULT_RESOURCE);
    }

    private static void printResults(List<DuelResult> results, List<PlayerSpec> specs, int numGames, long elapsedMs) {
        Map<Integer, Long> winsBySeat = new TreeMap<>();
        for (DuelResult r : results) {
            if (r.hasWinner()) {
                winsBySeat.merge(r.winnerSeat(), 1L, Long::sum);
            }
        }
        double avgTurns = results.stream().mapToInt(DuelResult::turns).average().orElse(0.0);

        System.out.println("=== Results ===\n");
        for (PlayerSpec spec : specs) {
            long wins = winsBySeat.getOrDefault(spec.seat(), 0L);
            double pct = (double) wins / numGames * 100.0;
            String bar = "█".repeat((int) (pct / 2.0));
            System.out.printf("  Seat %d %-12s %5.1f%% %s (%d)%n", spec.seat(), spec.heroId(), pct, bar, wins);
        }

        long noWinner = results.stream().filter(r -> !r.hasWinner()).count();
        if (noWinner > 0) {
            double pct = (double) noWinner / numGames * 100.0;
            System.out.printf("  No winner: %5.1f%% (%d)%n", pct, noWinner);
        }
        System.out.printf("%nAverage game length: %.2f turns%n", avgTurns);

        System.out.println();
        double elapsedSec = elapsedMs / 1000.0;
        double gamesPerSec = elapsedSec > 0 ? numGames / elapsedSec : 0;
        System.out.printf("Simulation completed in %.2fs (%.0f games/sec)%n", elapsedSec, gamesPerSec);
    }
}
