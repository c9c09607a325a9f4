package com.jphrase;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

public class PhraseLoggingConfigTest {

    private final Logger packageLog = Logger.getLogger("com.jphrase");

    @BeforeEach
    @AfterEach
    public void restore() {
        System.clearProperty(PhraseLoggingConfig.LEVEL_PROPERTY);
        packageLog.setLevel(null);
    }

    @Test
    public void testLevelFromProperty() {
        System.setProperty(PhraseLoggingConfig.LEVEL_PROPERTY, " finer ");

        PhraseLoggingConfig.configurePhraseLogging();

        assertEquals(Level.FINER, packageLog.getLevel());
        assertTrue(Logger.getLogger("com.jphrase.reduce.PhraseReducer").isLoggable(Level.FINER));
    }

    @Test
    public void testNoPropertyLeavesLoggersAlone() {
        PhraseLoggingConfig.configurePhraseLogging();

        assertNull(packageLog.getLevel());
    }

    @Test
    public void testUnknownLevelIsIgnored() {
        System.setProperty(PhraseLoggingConfig.LEVEL_PROPERTY, "chatty");

        PhraseLoggingConfig.configurePhraseLogging();

        assertNull(packageLog.getLevel());
    }
}
