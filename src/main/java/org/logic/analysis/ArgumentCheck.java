package org.logic.analysis;

import org.logic.formula.Formula;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Esito della verifica di validità di un argomento (premesse ⊨ conclusione).
 *
 * @param counterexample primo assegnamento con premesse vere e conclusione falsa;
 *                       null se l'argomento è valido
 */
public record ArgumentCheck(List<Formula> premises,
                            Formula conclusion,
                            boolean valid,
                            Map<String, Boolean> counterexample) {

    public ArgumentCheck {
        premises = List.copyOf(premises);
        if (valid == (counterexample != null)) {
            throw new IllegalArgumentException("Un argomento invalido richiede un controesempio, uno valido nessuno");
        }
    }

    public Optional<Map<String, Boolean>> findCounterexample() {
        return Optional.ofNullable(counterexample);
    }
}
