package com.jphrase.registry;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.util.logging.Logger;

/**
 * Dictionary of phrases keyed by every normalized prefix. For {@code perform_special_task} the
 * registry holds {@code perform} and {@code perform_special} as {@link PhraseStatus#INCOMPLETE}
 * and {@code perform_special_task} as {@link PhraseStatus#COMPLETE}.
 *
 * <p>Registration is atomic: a phrase that conflicts with an existing entry leaves the registry
 * exactly as it was.
 */
public class PhraseRegistry implements PhraseLookup {
    private static final Logger LOG = Logger.getLogger(PhraseRegistry.class.getName());

    static final String SEPARATOR = "_";

    private final MutableMap<String, PhraseStatus> parts = Maps.mutable.empty();

    /**
     * Registers {@code phrase}. Empty segments are dropped, so {@code "_a__b_"} registers
     * {@code a_b}; a phrase with no segments at all is ignored.
     *
     * @throws PhraseConflictException if a prefix of the phrase is already complete, or the
     *                                 phrase itself is already a prefix of another phrase
     */
    public void addPhrase(String phrase) {
        MutableList<String> segments = normalize(phrase);
        if (segments.isEmpty()) {
            return;
        }

        MutableList<String> prefixes = Lists.mutable.empty();
        StringBuilder running = new StringBuilder();
        for (String segment : segments) {
            if (running.length() > 0) {
                running.append(SEPARATOR);
            }
            running.append(segment);
            prefixes.add(running.toString());
        }

        String full = prefixes.getLast();
        MutableList<String> incomplete = prefixes.subList(0, prefixes.size() - 1);

        for (String prefix : incomplete) {
            if (parts.get(prefix) == PhraseStatus.COMPLETE) {
                throw new PhraseConflictException(ConflictKind.COMPLETE_VERSION_EXISTS, phrase, prefix);
            }
        }
        if (parts.get(full) == PhraseStatus.INCOMPLETE) {
            throw new PhraseConflictException(ConflictKind.INCOMPLETE_VERSION_EXISTS, phrase, full);
        }

        incomplete.forEach(prefix -> parts.putIfAbsent(prefix, PhraseStatus.INCOMPLETE));
        parts.put(full, PhraseStatus.COMPLETE);

        LOG.fine(() -> "Registered phrase '" + full + "' (" + segments.size() + " words)");
    }

    /**
     * Registers each phrase in order, stopping at the first conflict. Phrases before the
     * conflicting one remain registered.
     */
    public void addPhrases(Iterable<String> phrases) {
        for (String phrase : phrases) {
            addPhrase(phrase);
        }
    }

    @Override
    public PhraseStatus getPhraseStatus(String text) {
        return parts.getIfAbsentValue(text, PhraseStatus.NOT_A_PHRASE);
    }

    /**
     * @return the number of distinct keys held, prefixes included
     */
    public int phraseCount() {
        return parts.size();
    }

    static MutableList<String> normalize(String phrase) {
        if (phrase == null) {
            return Lists.mutable.empty();
        }
        return Lists.mutable.with(phrase.split(SEPARATOR)).reject(String::isEmpty);
    }
}
