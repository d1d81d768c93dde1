package org.logic.catalog;

/**
 * Famiglie di logiche presenti nel catalogo dei simboli.
 *
 * Solo PROPOSITIONAL ha una semantica nel motore; le altre famiglie servono
 * alla sola visualizzazione.
 */
public enum LogicType {
    PROPOSITIONAL("Logica proposizionale", "Proposizioni atomiche e connettivi vero-funzionali."),
    MODAL("Logica modale", "Estende la logica proposizionale con necessità e possibilità."),
    FIRST_ORDER("Logica del primo ordine", "Quantificazione su oggetti: per ogni ed esiste."),
    TEMPORAL("Logica temporale", "Ragionamento sul tempo: sempre, prima o poi, finché."),
    DEONTIC("Logica deontica", "Obblighi, permessi e divieti."),
    EPISTEMIC("Logica epistemica", "Conoscenza e credenze degli agenti.");

    private final String displayName;
    private final String description;

    LogicType(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }
}
