package org.nd;

import org.nd.engine.DerivationEngine;
import org.nd.engine.InvalidConfigurationException;
import org.nd.engine.ProofChecker;
import org.nd.engine.ProofResult;
import org.nd.engine.SearchConfiguration;
import org.nd.parser.FormulaParser;
import org.nd.parser.FormulaSyntaxException;
import org.nd.parser.Statement;
import org.nd.report.ProofFormatter;
import org.nd.rules.RuleName;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.LogManager;
import java.util.stream.Stream;

/**
 * DIMOSTRATORE IN DEDUZIONE NATURALE
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: enunciato da riga di comando, da file (uno per riga) o da tutti i file .txt di una directory
 * 2. PARSING: enunciato "A1, ..., An / C" -&gt; assunzioni e conclusione (ANTLR)
 * 3. RICERCA: motore di derivazione con budget di passi, priorità delle regole, profondità e tempo massimi
 * 4. VERIFICA FACOLTATIVA: ricontrollo indipendente delle prove trovate (-verify)
 * 5. OUTPUT: trascrizione della prova su console e, con -o, nella cartella RESULT/
 *
 * CODICI DI USCITA:
 * - 0: tutti gli enunciati dimostrati
 * - 2: almeno una ricerca esaurita senza prova
 * - 1: errori di sintassi, di configurazione o di accesso ai file
 */
public final class Main {
    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String STATEMENT_PARAM = "-s";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String STEPS_PARAM = "-n";
    private static final String DEPTH_PARAM = "-depth";
    private static final String LENGTH_PARAM = "-l";
    private static final String RULES_PARAM = "-rules=";
    private static final String VERIFY_PARAM = "-verify";

    /**
     * Codici di uscita
     * */
    static final int EXIT_PROVEN = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_EXHAUSTED = 2;

    /** Sottocartella dei risultati nella directory di output */
    private static final String RESULT_DIR = "RESULT";

    /** Prefisso delle righe di commento nei file di enunciati */
    private static final String COMMENT_PREFIX = "#";

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        loadLoggingConfiguration();
        int exitCode = run(args);
        if (exitCode != EXIT_PROVEN) {
            System.exit(exitCode);
        }
    }

    /**
     * Esegue l'intera pipeline e restituisce il codice di uscita.
     *
     * FLUSSO ESECUZIONE:
     * 1. Parsing e validazione parametri linea di comando
     * 2. Scelta della modalità (enunciato, file, directory, input interattivo)
     * 3. Riepilogo esiti e calcolo del codice di uscita
     *
     * @param args parametri linea di comando
     * @return codice di uscita
     */
    static int run(String[] args) {
        System.out.println("---> AVVIO DIMOSTRATORE DEDUZIONE NATURALE <---");

        try {
            CliConfiguration config = parseAndValidateArguments(args);
            if (config == null) {
                return EXIT_ERROR;
            }
            if (config.helpOnly) {
                return EXIT_PROVEN;
            }

            displayConfigurationSummary(config);
            List<Outcome> outcomes = executeMainPipeline(config);
            return computeExitCode(outcomes);

        } catch (IOException e) {
            System.out.println("[E] Errore di accesso ai file: " + e.getMessage());
            return EXIT_ERROR;
        } finally {
            System.out.println("---> FINE ESECUZIONE DIMOSTRATORE <---");
        }
    }

    /**
     * Esegue la modalità scelta dalla configurazione.
     *
     * @param config configurazione validata
     * @return esiti dei singoli enunciati
     */
    private static List<Outcome> executeMainPipeline(CliConfiguration config) throws IOException {
        if (config.statement != null) {
            System.out.println("[I] Modalità: Enunciato singolo");
            return processStatements("enunciato", List.of(config.statement), config);
        } else if (config.filePath != null) {
            System.out.println("[I] Modalità: Elaborazione file singolo");
            return processFile(Paths.get(config.filePath), config);
        } else if (config.directoryPath != null) {
            System.out.println("[I] Modalità: Elaborazione della directory");
            return processDirectory(config);
        } else {
            System.out.println("[I] Modalità: Input interattivo");
            return processStatements("enunciato", List.of(readStatementFromConsole(System.in)), config);
        }
    }

    /**
     * Errori prevalgono su ricerche esaurite, che prevalgono su prove trovate.
     */
    static int computeExitCode(List<Outcome> outcomes) {
        if (outcomes.contains(Outcome.ERROR)) {
            return EXIT_ERROR;
        }
        if (outcomes.contains(Outcome.EXHAUSTED)) {
            return EXIT_EXHAUSTED;
        }
        return EXIT_PROVEN;
    }

    /**
     * Carica la configurazione di logging dal classpath, se presente.
     */
    private static void loadLoggingConfiguration() {
        try (InputStream config = Main.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione di logging non caricata: " + e.getMessage());
        }
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    /**
     * @param args array di parametri da processare
     * @return configurazione validata o null in caso di errore
     */
    private static CliConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(CliConfiguration config) {
        SearchConfiguration search = config.search;

        System.out.println("\n-->> CONFIGURAZIONE DIMOSTRATORE <<--");
        if (config.statement != null) {
            System.out.println("Enunciato: " + config.statement);
        } else if (config.filePath != null) {
            System.out.println("File: " + config.filePath);
        } else if (config.directoryPath != null) {
            System.out.println("Directory: " + config.directoryPath);
        }
        System.out.println("Budget di passi: " + search.getMaxSteps());
        System.out.println("Profondità massima scope: " + search.getMaxScopeDepth());
        System.out.println("Limite di tempo: " + search.getTimeLimit().map(limit -> limit.toSeconds() + " secondi").orElse("Nessuno"));
        System.out.println("Lunghezza massima prova: " + search.getMaxProofLength().map(length -> length + " righe").orElse("Nessuna"));
        System.out.println("Regole: " + String.join(", ", search.getRulePriority().stream().map(RuleName::symbol).toList()));
        System.out.println("Verifica prove: " + (config.verify ? "Sì" : "No"));
        System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "Solo console"));
        System.out.println("====================================\n");
    }

    //endregion

    //region ELABORAZIONE ENUNCIATI

    /**
     * Dimostra una sequenza di enunciati con un unico motore e salva le trascrizioni.
     *
     * @param baseName nome base del file di risultato
     * @param statements testi degli enunciati
     * @param config configurazione validata
     * @return esiti nell'ordine degli enunciati
     */
    private static List<Outcome> processStatements(String baseName, List<String> statements, CliConfiguration config) throws IOException {
        DerivationEngine engine = new DerivationEngine();
        StringBuilder transcript = new StringBuilder();
        List<Outcome> outcomes = new ArrayList<>();

        for (String text : statements) {
            StatementReport report = proveStatement(engine, text, config);
            System.out.println(report.text);
            transcript.append(report.text).append("\n");
            outcomes.add(report.outcome);
        }

        if (config.outputPath != null) {
            saveTranscript(transcript.toString(), baseName, config);
        }
        return outcomes;
    }

    /**
     * Analizza e dimostra un singolo enunciato.
     * Gli errori di sintassi sono riportati nella trascrizione, non propagati.
     */
    private static StatementReport proveStatement(DerivationEngine engine, String text, CliConfiguration config) {
        Statement statement;
        try {
            statement = FormulaParser.parseStatement(text);
        } catch (FormulaSyntaxException e) {
            String message = "[E] " + text + "\n    " + " ".repeat(e.getPosition()) + "^\n    " + e.getMessage() + "\n";
            return new StatementReport(message, Outcome.ERROR);
        }

        ProofResult result = engine.attemptProof(statement.assumptions(), statement.conclusion(), config.search);
        StringBuilder report = new StringBuilder();
        report.append(ProofFormatter.format(statement.assumptions(), statement.conclusion(), result));

        if (result.isFound() && config.verify) {
            List<String> violations = new ProofChecker().check(result.getLines());
            if (violations.isEmpty()) {
                report.append("[I] Prova verificata: nessuna violazione\n");
            } else {
                report.append("[E] Prova non valida:\n");
                violations.forEach(violation -> report.append("    ").append(violation).append("\n"));
                return new StatementReport(report.toString(), Outcome.ERROR);
            }
        }
        return new StatementReport(report.toString(), result.isFound() ? Outcome.PROVEN : Outcome.EXHAUSTED);
    }

    /**
     * Legge un file di enunciati: uno per riga, righe vuote e commenti (#) ignorati.
     */
    private static List<Outcome> processFile(Path file, CliConfiguration config) throws IOException {
        List<String> statements = readStatements(file);
        if (statements.isEmpty()) {
            System.out.println("[W] Nessun enunciato trovato in " + file.getFileName());
            return List.of();
        }
        System.out.println("[I] Enunciati letti da " + file.getFileName() + ": " + statements.size());
        return processStatements(getBaseFileName(file), statements, config);
    }

    static List<String> readStatements(Path file) throws IOException {
        List<String> statements = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith(COMMENT_PREFIX)) {
                statements.add(trimmed);
            }
        }
        return statements;
    }

    private static String readStatementFromConsole(InputStream input) throws IOException {
        System.out.print("Inserisci un enunciato (es. A -> B, A / B): ");
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        String line = reader.readLine();
        if (line == null) {
            throw new IOException("Nessun enunciato ricevuto dallo standard input");
        }
        return line.trim();
    }

    //endregion

    //region ELABORAZIONE DIRECTORY

    /**
     * Elabora tutti i file .txt della directory in parallelo, un tentativo per file.
     * L'output di ciascun file viene stampato al termine, nell'ordine dei nomi.
     */
    private static List<Outcome> processDirectory(CliConfiguration config) throws IOException {
        List<Path> files = findAllTxtFiles(config.directoryPath);
        if (files.isEmpty()) {
            System.out.println("[W] Nessun file .txt trovato nella directory specificata.");
            return List.of();
        }

        int threads = Math.max(1, Math.min(files.size(), Runtime.getRuntime().availableProcessors()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Outcome> outcomes = new ArrayList<>();
        int errors = 0;

        try {
            List<Future<FileReport>> futures = new ArrayList<>();
            for (Path file : files) {
                Callable<FileReport> task = () -> proveFile(file, config);
                futures.add(executor.submit(task));
            }

            for (int i = 0; i < files.size(); i++) {
                try {
                    FileReport report = futures.get(i).get();
                    System.out.println("Elaborazione: " + files.get(i).getFileName());
                    System.out.println(report.text);
                    outcomes.addAll(report.outcomes);
                } catch (ExecutionException e) {
                    System.out.println("[E] Errore nel file " + files.get(i).getFileName() + ": " + e.getCause());
                    outcomes.add(Outcome.ERROR);
                    errors++;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.out.println("[E] Elaborazione della directory interrotta");
            outcomes.add(Outcome.ERROR);
        } finally {
            executor.shutdownNow();
        }

        displayBatchSummary(files.size(), outcomes, errors);
        return outcomes;
    }

    /**
     * Dimostra gli enunciati di un file, accumulando l'output invece di stamparlo.
     */
    private static FileReport proveFile(Path file, CliConfiguration config) throws IOException {
        DerivationEngine engine = new DerivationEngine();
        StringBuilder text = new StringBuilder();
        List<Outcome> outcomes = new ArrayList<>();

        for (String statement : readStatements(file)) {
            StatementReport report = proveStatement(engine, statement, config);
            text.append(report.text).append("\n");
            outcomes.add(report.outcome);
        }

        if (config.outputPath != null) {
            saveTranscript(text.toString(), getBaseFileName(file), config);
        }
        return new FileReport(text.toString(), outcomes);
    }

    private static List<Path> findAllTxtFiles(String dirPath) throws IOException {
        try (Stream<Path> paths = Files.list(Paths.get(dirPath))) {
            return paths
                    .filter(path -> path.toString().toLowerCase().endsWith(".txt"))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        }
    }

    private static void displayBatchSummary(int totalFiles, List<Outcome> outcomes, int errors) {
        System.out.println("\n-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
        System.out.println("File elaborati: " + totalFiles);
        System.out.println("File con errori: " + errors);
        System.out.println("Enunciati dimostrati: " + outcomes.stream().filter(o -> o == Outcome.PROVEN).count());
        System.out.println("Ricerche esaurite: " + outcomes.stream().filter(o -> o == Outcome.EXHAUSTED).count());
        System.out.println("Enunciati con errori: " + outcomes.stream().filter(o -> o == Outcome.ERROR).count());
        System.out.println("====================================\n");
    }

    //endregion

    //region SALVATAGGIO RISULTATI

    private static void saveTranscript(String content, String baseName, CliConfiguration config) throws IOException {
        Path resultDir = Paths.get(config.outputPath).resolve(RESULT_DIR);
        Files.createDirectories(resultDir);
        Path target = resultDir.resolve(baseName + ".result.txt");
        Files.writeString(target, content, StandardCharsets.UTF_8);
        System.out.println("[I] Risultato salvato in " + target);
    }

    private static String getBaseFileName(Path file) {
        String fileName = file.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    //endregion

    //region HELP

    private static void printApplicationHelp() {
        System.out.println("\n::>> DIMOSTRATORE IN DEDUZIONE NATURALE <<::");
        System.out.println("Costruisce prove passo per passo per la logica proposizionale\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar deduzione-naturale.jar [opzioni]\n");

        System.out.println("INPUT (senza opzioni di input l'enunciato viene letto da console):");
        System.out.println("  -s <enunciato>   Dimostra un singolo enunciato, es. \"A -> B, A / B\"");
        System.out.println("  -f <file>        Dimostra gli enunciati di un file, uno per riga (# = commento)");
        System.out.println("  -d <directory>   Dimostra tutti i file .txt di una directory, in parallelo\n");

        System.out.println("RICERCA:");
        System.out.println("  -n <passi>       Budget di passi (default: " + SearchConfiguration.DEFAULT_MAX_STEPS + ")");
        System.out.println("  -depth <n>       Profondità massima dei sotto-ragionamenti (default: "
                + SearchConfiguration.DEFAULT_MAX_SCOPE_DEPTH + ")");
        System.out.println("  -t <secondi>     Limite di tempo per enunciato (default: nessuno)");
        System.out.println("  -l <righe>       Lunghezza massima della prova, assunzioni comprese (default: nessuna)");
        System.out.println("  -rules=<R1,R2>   Regole attive in ordine di priorità (es. MPP,&E,vE,CP,RAA)\n");

        System.out.println("OUTPUT:");
        System.out.println("  -o <directory>   Salva le trascrizioni in <directory>/RESULT/");
        System.out.println("  -verify          Ricontrolla ogni prova trovata");
        System.out.println("  -h               Mostra questa guida\n");

        System.out.println("SINTASSI DELLE FORMULE:");
        System.out.println("  Variabili: lettere maiuscole (A, P, AB)");
        System.out.println("  Operatori: ~ (non), & (e), v (o), -> (implica), parentesi ( )");
        System.out.println("  Enunciato: assunzioni separate da virgole, '/' prima della conclusione\n");

        System.out.println("REGOLE:");
        for (RuleName rule : RuleName.values()) {
            if (rule.isInferenceRule()) {
                System.out.println("  " + rule.symbol() + "\t" + rule.name());
            }
        }
        System.out.println();

        System.out.println("CODICI DI USCITA: 0 = tutto dimostrato, 2 = ricerca esaurita, 1 = errore");
        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Esito di un singolo enunciato.
     */
    enum Outcome {
        PROVEN,
        EXHAUSTED,
        ERROR
    }

    /**
     * Configurazione validata dell'applicazione.
     */
    private static class CliConfiguration {
        final boolean helpOnly;
        final String statement;
        final String filePath;
        final String directoryPath;
        final String outputPath;
        final boolean verify;
        final SearchConfiguration search;

        CliConfiguration(boolean helpOnly, String statement, String filePath, String directoryPath,
                         String outputPath, boolean verify, SearchConfiguration search) {
            this.helpOnly = helpOnly;
            this.statement = statement;
            this.filePath = filePath;
            this.directoryPath = directoryPath;
            this.outputPath = outputPath;
            this.verify = verify;
            this.search = search;
        }

        static CliConfiguration help() {
            return new CliConfiguration(true, null, null, null, null, false, SearchConfiguration.defaults());
        }
    }

    /**
     * Parser dei parametri della linea di comando.
     */
    private static class ArgumentParser {

        /**
         * PARAMETRI SUPPORTATI:
         * -h, -s &lt;enunciato&gt;, -f &lt;file&gt;, -d &lt;dir&gt; (input mutualmente esclusivi),
         * -n &lt;passi&gt;, -depth &lt;n&gt;, -l &lt;righe&gt;, -t &lt;secondi&gt;, -rules=&lt;lista&gt;, -o &lt;dir&gt;, -verify
         *
         * @param args parametri da linea comando
         * @return configurazione validata
         * @throws IllegalArgumentException se parametri non validi
         */
        CliConfiguration parse(String[] args) {
            String statement = null;
            String filePath = null;
            String directoryPath = null;
            String outputPath = null;
            boolean verify = false;
            SearchConfiguration.Builder search = SearchConfiguration.builder();

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return CliConfiguration.help();
                    }
                    case STATEMENT_PARAM -> {
                        validateExclusiveInput(statement, filePath, directoryPath);
                        statement = getNextArgument(args, ++i, "enunciato");
                    }
                    case FILE_PARAM -> {
                        validateExclusiveInput(statement, filePath, directoryPath);
                        filePath = getNextArgument(args, ++i, "file");
                        validateFileExists(filePath);
                    }
                    case DIR_PARAM -> {
                        validateExclusiveInput(statement, filePath, directoryPath);
                        directoryPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(directoryPath);
                    }
                    case OUTPUT_PARAM -> outputPath = getNextArgument(args, ++i, "directory output");
                    case STEPS_PARAM -> search.maxSteps(parseInteger(getNextArgument(args, ++i, "numero passi"), "budget di passi"));
                    case DEPTH_PARAM -> search.maxScopeDepth(parseInteger(getNextArgument(args, ++i, "profondità"), "profondità"));
                    case LENGTH_PARAM -> search.maxProofLength(parseInteger(getNextArgument(args, ++i, "numero righe"), "lunghezza massima"));
                    case TIMEOUT_PARAM -> search.timeLimit(Duration.ofSeconds(
                            parseInteger(getNextArgument(args, ++i, "numero secondi"), "timeout")));
                    case VERIFY_PARAM -> verify = true;
                    default -> {
                        if (args[i].startsWith(RULES_PARAM)) {
                            search.rulePriority(parseRules(args[i].substring(RULES_PARAM.length())));
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            // InvalidConfigurationException estende IllegalArgumentException
            return new CliConfiguration(false, statement, filePath, directoryPath, outputPath, verify, search.build());
        }

        private void validateExclusiveInput(String statement, String filePath, String directoryPath) {
            if (statement != null || filePath != null || directoryPath != null) {
                throw new IllegalArgumentException("Specificare un solo input tra -s, -f e -d");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] + " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parseInteger(String value, String description) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore non valido per " + description + ": " + value);
            }
        }

        private List<RuleName> parseRules(String value) {
            if (value.isBlank()) {
                throw new InvalidConfigurationException("Valore -rules vuoto");
            }
            List<RuleName> rules = new ArrayList<>();
            for (String label : value.split(",")) {
                rules.add(RuleName.fromLabel(label));
            }
            return rules;
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.isFile()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateDirectoryExists(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Directory non esistente: " + dirPath);
            }
            if (!dir.canRead()) {
                throw new IllegalArgumentException("Directory non leggibile: " + dirPath);
            }
        }
    }

    /**
     * Trascrizione ed esito di un enunciato.
     */
    private record StatementReport(String text, Outcome outcome) {}

    /**
     * Trascrizione ed esiti degli enunciati di un file.
     */
    private record FileReport(String text, List<Outcome> outcomes) {}

    //endregion
}
