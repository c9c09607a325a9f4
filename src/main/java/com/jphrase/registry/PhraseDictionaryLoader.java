package com.jphrase.registry;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Logger;

/**
 * Reads a phrase dictionary, a JSON array of strings such as {@code ["perform_task", "special"]},
 * into a {@link PhraseRegistry}.
 */
public class PhraseDictionaryLoader {
    private static final Logger LOG = Logger.getLogger(PhraseDictionaryLoader.class.getName());

    private final JsonFactory factory = new JsonFactory();

    /**
     * @return the number of phrases read
     * @throws IOException             if the input is not a JSON array of strings
     * @throws PhraseConflictException if a phrase conflicts with one already registered
     */
    public int load(InputStream input, PhraseRegistry registry) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token != JsonToken.START_ARRAY) {
                throw new IOException("Phrase dictionary must be a JSON array, found: " + token);
            }

            int count = 0;
            while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
                if (token != JsonToken.VALUE_STRING) {
                    throw new IOException("Phrase dictionary entries must be strings, found: " + token
                            + " at " + parser.currentLocation().offsetDescription());
                }
                registry.addPhrase(parser.getText());
                count++;
            }

            int loaded = count;
            LOG.fine(() -> "Loaded " + loaded + " phrases");
            return count;
        }
    }
}
