package org.calista.formalizer.llm;

import org.calista.formalizer.core.CollaboratorException;

import java.util.List;

/**
 * Language-model collaborator: role-tagged prompt in, free-form text out.
 *
 * <p>The caller parses the text (decomposition list, grounding verdict, code candidate).
 * An empty completion is reported as {@link CollaboratorException.Kind#MALFORMED_RESPONSE}.</p>
 */
public interface LanguageModel {

    String complete(List<ChatMessage> messages, double temperature) throws CollaboratorException;
}
