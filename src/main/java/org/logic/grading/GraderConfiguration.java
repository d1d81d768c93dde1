package org.logic.grading;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * CONFIGURAZIONE CORRETTORE - Parametri del correttore con valori predefiniti
 *
 * PARAMETRI:
 * • grader.maxVariables: variabili distinte ammesse prima di costruire una tabella (1-20, predefinito 16)
 * • grader.revealCounterexamples: se i dettagli riportano assegnamenti distintivi (predefinito true)
 * • grader.maxFormulaLength: caratteri ammessi in un testo di formula prima del parsing (1-5000, predefinito 1000)
 *
 * Una tabella di 2^20 righe tiene in memoria un assegnamento per riga: il limite
 * superiore di variabili resta sotto la soglia in cui la costruzione esaurisce l'heap.
 *
 * @param maxVariables limite di variabili per formula o coppia di formule confrontate
 * @param revealCounterexamples mostra allo studente un assegnamento che distingue le formule
 * @param maxFormulaLength lunghezza massima di un testo di formula; limita anche la profondità di annidamento
 */
public record GraderConfiguration(int maxVariables, boolean revealCounterexamples, int maxFormulaLength) {

    private static final Logger LOGGER = Logger.getLogger(GraderConfiguration.class.getName());

    public static final String RESOURCE_NAME = "grader.properties";
    public static final String MAX_VARIABLES_KEY = "grader.maxVariables";
    public static final String REVEAL_COUNTEREXAMPLES_KEY = "grader.revealCounterexamples";
    public static final String MAX_FORMULA_LENGTH_KEY = "grader.maxFormulaLength";

    public static final int DEFAULT_MAX_VARIABLES = 16;
    public static final int MIN_VARIABLES = 1;
    public static final int MAX_VARIABLES = 20;

    public static final int DEFAULT_MAX_FORMULA_LENGTH = 1000;
    public static final int MAX_FORMULA_LENGTH = 5000;

    public GraderConfiguration {
        if (maxVariables < MIN_VARIABLES || maxVariables > MAX_VARIABLES) {
            throw new IllegalArgumentException("Limite variabili deve essere tra " + MIN_VARIABLES + " e "
                    + MAX_VARIABLES + ", ricevuto: " + maxVariables);
        }
        if (maxFormulaLength < 1 || maxFormulaLength > MAX_FORMULA_LENGTH) {
            throw new IllegalArgumentException("Lunghezza massima formula deve essere tra 1 e "
                    + MAX_FORMULA_LENGTH + ", ricevuto: " + maxFormulaLength);
        }
    }

    /**
     * Configurazione con la lunghezza massima di formula predefinita.
     */
    public GraderConfiguration(int maxVariables, boolean revealCounterexamples) {
        this(maxVariables, revealCounterexamples, DEFAULT_MAX_FORMULA_LENGTH);
    }

    public static GraderConfiguration defaults() {
        return new GraderConfiguration(DEFAULT_MAX_VARIABLES, true, DEFAULT_MAX_FORMULA_LENGTH);
    }

    /**
     * Legge {@value #RESOURCE_NAME} dal classpath; senza file valgono i predefiniti.
     *
     * @throws IllegalArgumentException se un valore presente non è valido
     * @throws UncheckedIOException se il file esiste ma non è leggibile
     */
    public static GraderConfiguration load() {
        try (InputStream input = GraderConfiguration.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (input == null) {
                LOGGER.fine("Nessun " + RESOURCE_NAME + " nel classpath, uso i valori predefiniti");
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(input);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Lettura di " + RESOURCE_NAME + " fallita", e);
        }
    }

    /**
     * Costruisce la configurazione dalle proprietà; le chiavi mancanti assumono il valore predefinito.
     *
     * @throws IllegalArgumentException se un valore non è interpretabile o è fuori intervallo
     */
    public static GraderConfiguration fromProperties(Properties properties) {
        int maxVariables = readInt(properties, MAX_VARIABLES_KEY, DEFAULT_MAX_VARIABLES);
        int maxFormulaLength = readInt(properties, MAX_FORMULA_LENGTH_KEY, DEFAULT_MAX_FORMULA_LENGTH);

        boolean revealCounterexamples = true;
        String rawReveal = properties.getProperty(REVEAL_COUNTEREXAMPLES_KEY);
        if (rawReveal != null) {
            String value = rawReveal.trim().toLowerCase(Locale.ROOT);
            if (!value.equals("true") && !value.equals("false")) {
                throw new IllegalArgumentException("Valore non valido per " + REVEAL_COUNTEREXAMPLES_KEY + ": " + rawReveal);
            }
            revealCounterexamples = Boolean.parseBoolean(value);
        }

        GraderConfiguration configuration = new GraderConfiguration(maxVariables, revealCounterexamples, maxFormulaLength);
        LOGGER.fine("Configurazione correttore: " + configuration);
        return configuration;
    }

    private static int readInt(Properties properties, String key, int defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Valore non valido per " + key + ": " + raw);
        }
    }
}
