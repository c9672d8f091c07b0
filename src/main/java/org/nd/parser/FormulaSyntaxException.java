package org.nd.parser;

/**
 * Errore sintattico nel testo di una formula o di un enunciato.
 *
 * È sempre fatale per il parsing corrente: non esiste recupero e non viene
 * restituito alcun risultato parziale.
 */
public class FormulaSyntaxException extends RuntimeException {

    /** Posizione (0-based) del carattere in cui l'errore è stato rilevato */
    private final int position;

    /** Descrizione del problema riscontrato */
    private final String reason;

    public FormulaSyntaxException(int position, String reason) {
        this(position, reason, null);
    }

    public FormulaSyntaxException(int position, String reason, Throwable cause) {
        super("Errore di sintassi alla posizione " + position + ": " + reason, cause);
        this.position = position;
        this.reason = reason;
    }

    public int getPosition() {
        return position;
    }

    public String getReason() {
        return reason;
    }
}
