package org.nd.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * REGISTRO DELLA PROVA - Sequenza ordinata delle righe derivate
 *
 * Il registro cresce solo in coda: ogni riga riceve il numero successivo
 * all'ultima, quindi i numeri sono contigui, unici e strettamente crescenti.
 *
 * L'unica eccezione è {@link #rollbackTo(int)}, con cui il motore abbandona un
 * sotto-ragionamento fallito: le righe scritte dopo il punto di ripristino non
 * sono mai state citate da righe esterne a quel tentativo e vengono scartate
 * insieme ad esso.
 */
public class ProofLedger {

    private static final Logger LOGGER = Logger.getLogger(ProofLedger.class.getName());

    private final List<ProofLine> lines = new ArrayList<>();

    /**
     * @return numero che verrà assegnato alla prossima riga
     */
    public int nextLineNumber() {
        return lines.size() + 1;
    }

    /**
     * Aggiunge una riga in coda.
     *
     * @param line riga con numero pari a {@link #nextLineNumber()}
     * @throws IllegalArgumentException se il numero non è quello atteso
     */
    public void append(ProofLine line) {
        if (line.number() != nextLineNumber()) {
            throw new IllegalArgumentException(String.format(
                    "Numero di riga non valido: atteso %d, ricevuto %d", nextLineNumber(), line.number()));
        }
        lines.add(line);
        LOGGER.finest("Riga registrata: " + line);
    }

    /**
     * @param number numero di riga (1-based)
     * @return riga corrispondente
     * @throws IllegalArgumentException se la riga non esiste
     */
    public ProofLine line(int number) {
        if (number < 1 || number > lines.size()) {
            throw new IllegalArgumentException("Riga inesistente: " + number);
        }
        return lines.get(number - 1);
    }

    public int size() {
        return lines.size();
    }

    /**
     * Scarta tutte le righe successive alla dimensione indicata.
     *
     * @param size dimensione da ripristinare (0 &lt;= size &lt;= size())
     */
    public void rollbackTo(int size) {
        if (size < 0 || size > lines.size()) {
            throw new IllegalArgumentException("Punto di ripristino non valido: " + size);
        }
        if (size < lines.size()) {
            LOGGER.fine(String.format("Ripristino registro: scartate righe %d-%d", size + 1, lines.size()));
            lines.subList(size, lines.size()).clear();
        }
    }

    /**
     * @return copia immutabile delle righe nell'ordine di registrazione
     */
    public List<ProofLine> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(lines));
    }
}
