package net.seitter.heapstore;

import net.seitter.heapstore.buffer.BufferPoolStatistics;
import net.seitter.heapstore.buffer.EvictionEvent;
import net.seitter.heapstore.index.IndexMetadata;
import net.seitter.heapstore.schema.Row;
import net.seitter.heapstore.table.PageInfo;
import net.seitter.heapstore.table.TableHeap;
import net.seitter.heapstore.web.StatsServer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.History;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Interactive inspection console over a data directory: lists tables and indexes,
 * dumps rows and shows buffer pool statistics.
 */
public class HeapStoreConsole {
    private static final Logger logger = LoggerFactory.getLogger(HeapStoreConsole.class);

    private static final String HISTORY_FILE = ".heapstore_history";
    private static final int DEFAULT_SCAN_LIMIT = 20;

    private static final List<String> COMMANDS = Arrays.asList(
            "help", "tables", "pages", "scan", "indexes", "stats", "evictions", "serve", "exit"
    );

    private final StorageEngine engine;
    private StatsServer statsServer;

    public HeapStoreConsole(StorageEngine engine) {
        this.engine = engine;
    }

    public static void main(String[] args) {
        StorageConfig config = StorageConfig.load();
        if (args.length > 0) {
            config = config.toBuilder().dataDir(Paths.get(args[0])).build();
        }

        try {
            HeapStoreConsole console = new HeapStoreConsole(new StorageEngine(config));
            console.start();
        } catch (IOException e) {
            logger.error("Failed to open data directory {}", config.getDataDir(), e);
            System.exit(1);
        }
    }

    /**
     * Runs the read-execute-print loop on the system terminal until {@code exit} or end of input.
     */
    public void start() {
        try (Terminal terminal = TerminalBuilder.builder()
                .name("HeapStore Terminal")
                .system(true)
                .build()) {

            Path historyFile = Paths.get(System.getProperty("user.home"), HISTORY_FILE);
            History history = new DefaultHistory();
            LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .history(history)
                    .variable(LineReader.HISTORY_FILE, historyFile)
                    .completer(new StringsCompleter(COMMANDS))
                    .option(LineReader.Option.CASE_INSENSITIVE, true)
                    .option(LineReader.Option.AUTO_LIST, true)
                    .build();

            terminal.writer().println("HeapStore console - data directory " +
                    engine.getConfig().getDataDir().toAbsolutePath());
            terminal.writer().println("Type 'help' for the list of commands, 'exit' to quit");
            terminal.writer().flush();

            while (true) {
                String line;
                try {
                    line = lineReader.readLine("heapstore> ").trim();
                } catch (UserInterruptException e) {
                    continue;
                } catch (EndOfFileException e) {
                    break;
                }
                if (line.equalsIgnoreCase("exit") || line.equalsIgnoreCase("quit")) {
                    break;
                }
                if (line.isEmpty()) {
                    continue;
                }

                try {
                    terminal.writer().println(execute(line));
                } catch (Exception e) {
                    terminal.writer().println("Error: " + e.getMessage());
                    logger.error("Command '{}' failed", line, e);
                }
                terminal.writer().flush();
            }

            try {
                history.save();
            } catch (IOException e) {
                logger.warn("Failed to save command history: {}", e.getMessage());
            }
        } catch (IOException e) {
            logger.error("Error in console", e);
        } finally {
            shutdown();
        }
    }

    /**
     * Executes one console command.
     *
     * @param line The command line
     * @return The text to print
     * @throws IOException If the storage engine fails
     * @throws IllegalArgumentException If the command or its arguments are invalid
     */
    public String execute(String line) throws IOException {
        String[] parts = line.trim().split("\\s+");
        String command = parts[0].toLowerCase(Locale.ROOT);

        switch (command) {
            case "help":
                return help();
            case "tables":
                return tables();
            case "pages":
                return pages(argument(parts, 1, "pages <table>"));
            case "scan":
                return scan(argument(parts, 1, "scan <table> [limit]"),
                        parts.length > 2 ? parseNumber(parts[2], "limit") : DEFAULT_SCAN_LIMIT);
            case "indexes":
                return indexes(parts.length > 1 ? parts[1] : null);
            case "stats":
                return stats();
            case "evictions":
                return evictions();
            case "serve":
                return serve(parts.length > 1 ? parseNumber(parts[1], "port") : engine.getConfig().getStatsPort());
            case "exit":
            case "quit":
                return "Bye";
            default:
                throw new IllegalArgumentException("Unknown command '" + parts[0] + "'. Type 'help' for the command list");
        }
    }

    private String help() {
        return String.join(System.lineSeparator(),
                "tables                 List tables",
                "pages <table>          Show the occupancy of every data page of a table",
                "scan <table> [limit]   Print rows of a table (default limit " + DEFAULT_SCAN_LIMIT + ")",
                "indexes [table]        List indexes",
                "stats                  Show buffer pool statistics of every open file",
                "evictions              Show the eviction log (enable with heapstore.buffer.eviction-log)",
                "serve [port]           Start the JSON stats server",
                "exit                   Leave the console");
    }

    private String tables() throws IOException {
        List<String> names = engine.tableNames();
        if (names.isEmpty()) {
            return "No tables";
        }
        StringBuilder sb = new StringBuilder();
        for (String name : names) {
            TableHeap heap = engine.getTable(name);
            if (heap == null) {
                sb.append(String.format("%-20s (missing file)%n", name));
            } else {
                sb.append(String.format("%-20s %d pages  %s%n", name, heap.getPageCount(), heap.getSchema()));
            }
        }
        return sb.toString().trim();
    }

    private String pages(String table) throws IOException {
        TableHeap heap = requireTable(table);
        List<PageInfo> pages = heap.describePages();
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Table '%s': %d pages%n", table, pages.size()));
        for (PageInfo info : pages) {
            sb.append(info.isFormatted() ? info.toString() : "page " + info.getPageNumber() + ": unformatted")
                    .append(System.lineSeparator());
        }
        return sb.toString().trim();
    }

    private String scan(String table, int limit) throws IOException {
        TableHeap heap = requireTable(table);
        StringBuilder sb = new StringBuilder();
        Iterator<Row> rows = heap.scan();
        int count = 0;
        while (rows.hasNext() && count < limit) {
            sb.append(rows.next()).append(System.lineSeparator());
            count++;
        }
        sb.append(count).append(count == 1 ? " row" : " rows");
        if (rows.hasNext()) {
            sb.append(" (limit reached)");
        }
        return sb.toString();
    }

    private String indexes(String table) {
        List<IndexMetadata> indexes = engine.getIndexRegistry().listIndexes(table);
        if (indexes.isEmpty()) {
            return "No indexes";
        }
        StringBuilder sb = new StringBuilder();
        for (IndexMetadata metadata : indexes) {
            boolean loaded = engine.getIndexRegistry().isLoaded(metadata.getTable(), metadata.getName());
            sb.append(metadata).append(loaded ? " [loaded]" : "").append(System.lineSeparator());
        }
        return sb.toString().trim();
    }

    private String stats() {
        List<BufferPoolStatistics> statistics = engine.getStatistics();
        if (statistics.isEmpty()) {
            return "No open files";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-28s %-6s %9s %6s %8s %8s %9s %7s %8s%n",
                "File", "Policy", "Size", "Dirty", "Hits", "Misses", "Evictions", "Reads", "Writes"));
        for (BufferPoolStatistics stats : statistics) {
            sb.append(String.format("%-28s %-6s %4d/%-4d %6d %8d %8d %9d %7d %8d%n",
                    stats.getFileName(), stats.getPolicy(), stats.getSize(), stats.getCapacity(),
                    stats.getDirtyPages(), stats.getHits(), stats.getMisses(), stats.getEvictions(),
                    stats.getPagesRead(), stats.getPagesWritten()));
        }
        return sb.toString().trim();
    }

    private String evictions() {
        List<EvictionEvent> events = engine.getEvictionLog();
        if (events.isEmpty()) {
            return engine.getConfig().isEvictionLogEnabled() ? "No evictions" : "Eviction log is disabled";
        }
        StringBuilder sb = new StringBuilder();
        for (EvictionEvent event : events) {
            sb.append(event).append(System.lineSeparator());
        }
        return sb.toString().trim();
    }

    private String serve(int port) {
        if (statsServer != null && statsServer.isRunning()) {
            return "Stats server already running on port " + statsServer.getPort();
        }
        statsServer = new StatsServer(engine, port);
        statsServer.start();
        return "Stats server running on http://localhost:" + statsServer.getPort() + "/api/status";
    }

    private TableHeap requireTable(String table) throws IOException {
        TableHeap heap = engine.getTable(table);
        if (heap == null) {
            throw new IllegalArgumentException("Unknown table '" + table + "'");
        }
        return heap;
    }

    private static String argument(String[] parts, int index, String usage) {
        if (parts.length <= index) {
            throw new IllegalArgumentException("Usage: " + usage);
        }
        return parts[index];
    }

    private static int parseNumber(String text, String what) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + what + ": " + text, e);
        }
    }

    /**
     * Stops the stats server and shuts the engine down.
     */
    public void shutdown() {
        if (statsServer != null) {
            statsServer.stop();
        }
        try {
            engine.shutdown();
        } catch (IOException e) {
            logger.error("Failed to shut down storage engine", e);
        }
    }
}
