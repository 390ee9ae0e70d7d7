package de.julielab.jules.ae.placemapping;

import de.julielab.jules.ae.placemapping.knowledge.KnowledgeBase;
import de.julielab.jules.ae.placemapping.knowledge.KnowledgeBaseLoader;
import de.julielab.jules.ae.placemapping.utils.KnowledgeTableException;

/**
 * The knowledge base built from the tables shipped with the library, loaded
 * once for all tests.
 */
public final class TestKnowledgeBase {
    private static KnowledgeBase defaults;

    private TestKnowledgeBase() {
    }

    public static synchronized KnowledgeBase defaults() {
        if (defaults == null) {
            try {
                defaults = KnowledgeBaseLoader.load(new PlaceMappingConfiguration());
            } catch (KnowledgeTableException e) {
                throw new IllegalStateException("The default knowledge tables could not be loaded", e);
            }
        }
        return defaults;
    }
}
