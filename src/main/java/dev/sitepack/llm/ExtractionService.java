package dev.sitepack.llm;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Black-box structured extraction: a prompt plus page content in, a JSON object out. Callers
 * must treat it as unreliable.
 */
public interface ExtractionService {

  /**
   * @throws ExtractionException if the call fails or the answer is not a JSON object
   */
  ObjectNode extract(String prompt, String content);
}
