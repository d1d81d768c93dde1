package org.logic.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

import static org.logic.catalog.DifficultyLevel.ADVANCED;
import static org.logic.catalog.DifficultyLevel.BEGINNER;
import static org.logic.catalog.DifficultyLevel.EXPERT;
import static org.logic.catalog.DifficultyLevel.INTERMEDIATE;
import static org.logic.catalog.LogicType.DEONTIC;
import static org.logic.catalog.LogicType.EPISTEMIC;
import static org.logic.catalog.LogicType.FIRST_ORDER;
import static org.logic.catalog.LogicType.MODAL;
import static org.logic.catalog.LogicType.PROPOSITIONAL;
import static org.logic.catalog.LogicType.TEMPORAL;

/**
 * CATALOGO OPERATORI - Simboli logici mostrati agli utenti
 *
 * Il catalogo descrive simboli di sei famiglie di logiche per tastiere simboliche,
 * legende ed esercizi di composizione. Solo i cinque connettivi restituiti da
 * {@link #parserSupported()} sono riconosciuti dal parser; le altre voci non hanno
 * alcuna semantica nel motore.
 */
public final class OperatorCatalog {

    /** Identificativi dei connettivi riconosciuti dalla grammatica */
    private static final Set<String> PARSER_OPERATOR_IDS = Set.of("NOT", "AND", "OR", "IMPLIES", "IFF");

    private static final List<LogicOperator> OPERATORS = List.of(
            //region PROPOSIZIONALE
            operator("NOT", "¬", List.of("~", "!"), "Negazione", PROPOSITIONAL, 1, 5,
                    "Inverte il valore di verità della proposizione.", "¬P", BEGINNER, List.of("~", "!", "¬")),
            operator("AND", "∧", List.of("&", "^"), "Congiunzione", PROPOSITIONAL, 2, 4,
                    "Vera solo se entrambe le proposizioni sono vere.", "P ∧ Q", BEGINNER, List.of("&", "^", "∧")),
            operator("OR", "∨", List.of("|"), "Disgiunzione", PROPOSITIONAL, 2, 3,
                    "Vera se almeno una delle proposizioni è vera.", "P ∨ Q", BEGINNER, List.of("|", "∨")),
            operator("IMPLIES", "→", List.of("->", "=>"), "Implicazione", PROPOSITIONAL, 2, 2,
                    "Falsa solo quando l'antecedente è vero e il conseguente falso.", "P → Q", BEGINNER,
                    List.of("->", "=>", "→")),
            operator("IFF", "↔", List.of("<->", "<=>"), "Biimplicazione", PROPOSITIONAL, 2, 1,
                    "Vera quando le due proposizioni hanno lo stesso valore.", "P ↔ Q", BEGINNER,
                    List.of("<->", "<=>", "↔")),
            operator("XOR", "⊕", List.of("^^"), "Disgiunzione esclusiva", PROPOSITIONAL, 2, 3,
                    "Vera quando esattamente una delle proposizioni è vera.", "P ⊕ Q", INTERMEDIATE, List.of("⊕")),
            operator("NAND", "↑", List.of(), "Negazione congiunta (Sheffer)", PROPOSITIONAL, 2, 4,
                    "Falsa solo se entrambe le proposizioni sono vere.", "P ↑ Q", ADVANCED, List.of("↑")),
            operator("NOR", "↓", List.of(), "Negazione disgiunta (Peirce)", PROPOSITIONAL, 2, 3,
                    "Vera solo se entrambe le proposizioni sono false.", "P ↓ Q", ADVANCED, List.of("↓")),
            operator("TRUE", "⊤", List.of("T"), "Vero", PROPOSITIONAL, 0, 6,
                    "Costante sempre vera.", "P ∨ ⊤", INTERMEDIATE, List.of("⊤")),
            operator("FALSE", "⊥", List.of("F"), "Falso", PROPOSITIONAL, 0, 6,
                    "Costante sempre falsa.", "P ∧ ⊥", INTERMEDIATE, List.of("⊥")),
            //endregion

            //region MODALE
            operator("NECESSARY", "□", List.of("[]", "L"), "Necessità", MODAL, 1, 5,
                    "La proposizione è vera in tutti i mondi accessibili.", "□P", ADVANCED, List.of("□", "[]")),
            operator("POSSIBLE", "◇", List.of("<>", "M"), "Possibilità", MODAL, 1, 5,
                    "La proposizione è vera in almeno un mondo accessibile.", "◇P", ADVANCED, List.of("◇", "<>")),
            //endregion

            //region PRIMO ORDINE
            operator("FORALL", "∀", List.of("A"), "Quantificatore universale", FIRST_ORDER, 1, 5,
                    "La proprietà vale per ogni elemento del dominio.", "∀x P(x)", INTERMEDIATE, List.of("∀")),
            operator("EXISTS", "∃", List.of("E"), "Quantificatore esistenziale", FIRST_ORDER, 1, 5,
                    "Esiste almeno un elemento del dominio con la proprietà.", "∃x P(x)", INTERMEDIATE, List.of("∃")),
            operator("EXISTS_UNIQUE", "∃!", List.of(), "Esistenza e unicità", FIRST_ORDER, 1, 5,
                    "Esiste uno e un solo elemento del dominio con la proprietà.", "∃!x P(x)", ADVANCED,
                    List.of("∃!")),
            operator("IDENTITY", "=", List.of(), "Identità", FIRST_ORDER, 2, 6,
                    "I due termini denotano lo stesso oggetto.", "x = y", INTERMEDIATE, List.of("=")),
            //endregion

            //region TEMPORALE
            operator("ALWAYS", "G", List.of("□"), "Sempre", TEMPORAL, 1, 5,
                    "La proposizione vale in ogni istante futuro.", "G P", EXPERT, List.of("G")),
            operator("EVENTUALLY", "F", List.of("◇"), "Prima o poi", TEMPORAL, 1, 5,
                    "La proposizione varrà in qualche istante futuro.", "F P", EXPERT, List.of("F")),
            operator("NEXT", "X", List.of("○"), "Prossimo istante", TEMPORAL, 1, 5,
                    "La proposizione vale nell'istante successivo.", "X P", EXPERT, List.of("X")),
            operator("UNTIL", "U", List.of(), "Finché", TEMPORAL, 2, 3,
                    "La prima proposizione vale finché non diventa vera la seconda.", "P U Q", EXPERT, List.of("U")),
            operator("RELEASE", "R", List.of(), "Rilascio", TEMPORAL, 2, 3,
                    "La seconda proposizione vale fino a quando la prima la rilascia.", "P R Q", EXPERT, List.of("R")),
            //endregion

            //region DEONTICA
            operator("OBLIGATORY", "O", List.of(), "Obbligatorio", DEONTIC, 1, 5,
                    "L'azione è obbligatoria.", "O P", ADVANCED, List.of("O")),
            operator("PERMITTED", "P", List.of(), "Permesso", DEONTIC, 1, 5,
                    "L'azione è permessa.", "P p", ADVANCED, List.of("P")),
            operator("FORBIDDEN", "F", List.of(), "Vietato", DEONTIC, 1, 5,
                    "L'azione è vietata.", "F p", ADVANCED, List.of("F")),
            //endregion

            //region EPISTEMICA
            operator("KNOWS", "K", List.of(), "Conoscenza", EPISTEMIC, 1, 5,
                    "L'agente sa che la proposizione è vera.", "K_a P", EXPERT, List.of("K")),
            operator("BELIEVES", "B", List.of(), "Credenza", EPISTEMIC, 1, 5,
                    "L'agente crede che la proposizione sia vera.", "B_a P", EXPERT, List.of("B"))
            //endregion
    );

    private OperatorCatalog() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    private static LogicOperator operator(String id, String symbol, List<String> altSymbols, String name,
                                          LogicType type, int arity, int precedence, String description,
                                          String example, DifficultyLevel difficulty, List<String> inputSymbols) {
        return new LogicOperator(id, symbol, altSymbols, name, type, arity, precedence,
                description, example, difficulty, inputSymbols);
    }

    //region RICERCHE

    /**
     * Tutte le voci, nell'ordine di catalogo.
     */
    public static List<LogicOperator> all() {
        return OPERATORS;
    }

    public static List<LogicOperator> byType(LogicType type) {
        return filter(operator -> operator.type() == type);
    }

    public static List<LogicOperator> byDifficulty(DifficultyLevel difficulty) {
        return filter(operator -> operator.difficulty() == difficulty);
    }

    /**
     * Ricerca per identificativo. Più famiglie non condividono mai un identificativo.
     */
    public static Optional<LogicOperator> findById(String id) {
        return OPERATORS.stream().filter(operator -> operator.id().equals(id)).findFirst();
    }

    /**
     * Prima voce, in ordine di catalogo, che usa il simbolo come grafia principale
     * o alternativa. I simboli temporali e deontici si sovrappongono: vince la prima famiglia.
     */
    public static Optional<LogicOperator> findBySymbol(String symbol) {
        return OPERATORS.stream().filter(operator -> operator.matchesSymbol(symbol)).findFirst();
    }

    /**
     * I connettivi proposizionali accettati dal parser.
     */
    public static List<LogicOperator> parserSupported() {
        return filter(operator -> PARSER_OPERATOR_IDS.contains(operator.id()));
    }

    private static List<LogicOperator> filter(Predicate<LogicOperator> predicate) {
        List<LogicOperator> selected = new ArrayList<>();
        for (LogicOperator operator : OPERATORS) {
            if (predicate.test(operator)) {
                selected.add(operator);
            }
        }
        return selected;
    }

    //endregion
}
