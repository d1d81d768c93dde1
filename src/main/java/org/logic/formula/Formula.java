package org.logic.formula;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * FORMULA PROPOSIZIONALE - Albero sintattico immutabile
 *
 * Rappresenta una formula della logica proposizionale come albero finito in cui
 * ogni nodo possiede i propri figli. Tre varianti di nodo:
 * • ATOM: variabile proposizionale identificata dal nome (P, Q, r_1, ...)
 * • NOT: negazione unaria dell'operando
 * • BINARY: connettivo binario (AND, OR, IMPLIES, IFF) con operandi sinistro e destro
 *
 * INVARIANTI:
 * • Albero aciclico e finito: i figli vengono fissati alla costruzione e non cambiano più
 * • Due atomi sono uguali se e solo se hanno lo stesso nome (case-sensitive)
 * • Uguaglianza strutturale e ordinata: P ∧ Q è diverso da Q ∧ P
 *
 * L'uguaglianza strutturale serve solo a collezioni e test: la correttezza di una
 * risposta si giudica sempre per equivalenza semantica.
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Varianti di nodo supportate nell'albero.
     */
    public enum Type {
        ATOM,    // Variabile atomica: P, Q, R, ...
        NOT,     // Negazione: ¬A
        BINARY   // Connettivo binario: A ∧ B, A ∨ B, A → B, A ↔ B
    }

    /** Nomi ammessi per le variabili: lettera iniziale, poi lettere, cifre o underscore */
    private static final Pattern ATOM_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

    private final Type type;

    /** Nome della variabile (solo per nodi ATOM) */
    private final String name;

    /** Operando (solo per nodi NOT) */
    private final Formula operand;

    /** Connettivo e operandi (solo per nodi BINARY) */
    private final Connective connective;
    private final Formula left;
    private final Formula right;

    //endregion

    //region COSTRUZIONE

    private Formula(Type type, String name, Formula operand, Connective connective, Formula left, Formula right) {
        this.type = type;
        this.name = name;
        this.operand = operand;
        this.connective = connective;
        this.left = left;
        this.right = right;
    }

    /**
     * Costruisce una foglia atomica.
     *
     * @param name nome della variabile proposizionale
     * @return nodo ATOM
     * @throws IllegalArgumentException se il nome è null o non rispetta la sintassi delle variabili
     */
    public static Formula atom(String name) {
        if (name == null || !ATOM_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Nome variabile atomica non valido: " + name);
        }
        return new Formula(Type.ATOM, name, null, null, null, null);
    }

    /**
     * Costruisce la negazione di una formula.
     *
     * @param operand formula da negare (non null)
     * @return nodo NOT
     * @throws IllegalArgumentException se operand null
     */
    public static Formula not(Formula operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando per negazione non può essere null");
        }
        return new Formula(Type.NOT, null, operand, null, null, null);
    }

    /**
     * Costruisce un nodo binario.
     *
     * @param connective connettivo principale
     * @param left operando sinistro
     * @param right operando destro
     * @return nodo BINARY
     * @throws IllegalArgumentException se uno dei parametri è null
     */
    public static Formula binary(Connective connective, Formula left, Formula right) {
        if (connective == null) {
            throw new IllegalArgumentException("Connettivo binario non può essere null");
        }
        if (left == null || right == null) {
            throw new IllegalArgumentException("Operandi del connettivo " + connective + " non possono essere null");
        }
        return new Formula(Type.BINARY, null, null, connective, left, right);
    }

    public static Formula and(Formula left, Formula right) {
        return binary(Connective.AND, left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return binary(Connective.OR, left, right);
    }

    public static Formula implies(Formula left, Formula right) {
        return binary(Connective.IMPLIES, left, right);
    }

    public static Formula iff(Formula left, Formula right) {
        return binary(Connective.IFF, left, right);
    }

    //endregion

    //region ACCESSO AI NODI

    public Type getType() {
        return type;
    }

    public boolean isAtom() {
        return type == Type.ATOM;
    }

    public boolean isNegation() {
        return type == Type.NOT;
    }

    public boolean isBinary() {
        return type == Type.BINARY;
    }

    /**
     * Verifica se il nodo è binario con il connettivo indicato.
     */
    public boolean isBinary(Connective expected) {
        return type == Type.BINARY && connective == expected;
    }

    /**
     * Letterale: atomo oppure negazione di un atomo.
     */
    public boolean isLiteral() {
        return type == Type.ATOM || (type == Type.NOT && operand.type == Type.ATOM);
    }

    public String getName() {
        requireType(Type.ATOM);
        return name;
    }

    public Formula getOperand() {
        requireType(Type.NOT);
        return operand;
    }

    public Connective getConnective() {
        requireType(Type.BINARY);
        return connective;
    }

    public Formula getLeft() {
        requireType(Type.BINARY);
        return left;
    }

    public Formula getRight() {
        requireType(Type.BINARY);
        return right;
    }

    private void requireType(Type expected) {
        if (type != expected) {
            throw new IllegalStateException("Operazione valida solo per nodi " + expected + ", nodo corrente: " + type);
        }
    }

    //endregion

    //region UGUAGLIANZA E HASH

    /**
     * Uguaglianza strutturale: stesso tipo, stesso connettivo, stessi figli nello stesso ordine.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Formula other = (Formula) obj;
        if (this.type != other.type) return false;

        return switch (this.type) {
            case ATOM -> this.name.equals(other.name);
            case NOT -> this.operand.equals(other.operand);
            case BINARY -> this.connective == other.connective
                    && this.left.equals(other.left)
                    && this.right.equals(other.right);
        };
    }

    @Override
    public int hashCode() {
        return switch (type) {
            case ATOM -> Objects.hash(type, name);
            case NOT -> Objects.hash(type, operand);
            case BINARY -> Objects.hash(type, connective, left, right);
        };
    }

    //endregion

    /**
     * Rappresentazione Unicode con il minimo di parentesi necessario.
     */
    @Override
    public String toString() {
        return FormulaPrinter.print(this);
    }
}
