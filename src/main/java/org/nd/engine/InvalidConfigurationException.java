package org.nd.engine;

/**
 * Configurazione di ricerca non valida, rifiutata prima di iniziare la prova.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
