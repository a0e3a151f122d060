package dev.verity.generation;

/** Prompt text sent to the chat model. Placeholders use {@link String#formatted}. */
final class PromptTemplates {

  private PromptTemplates() {}

  static final String ANSWER_SYSTEM =
      """
      You are a precise, factual assistant. Answer questions using ONLY the provided evidence.
      Rules:
      - Cite evidence using [1], [2], etc. markers matching the evidence numbers.
      - If the evidence doesn't contain enough information, say so clearly.
      - Never make up information not present in the evidence.
      - Be concise and direct.""";

  static final String ANSWER_STRICT_SYSTEM =
      """
      You are a precise, factual assistant operating in STRICT mode.
      Rules:
      - ONLY state facts that are DIRECTLY and EXPLICITLY supported by the evidence.
      - Cite every claim with [1], [2], etc.
      - If ANY doubt exists about whether the evidence supports a claim, do NOT include it.
      - If evidence is insufficient, state exactly what information is missing.
      - Never infer, extrapolate, or generalize beyond the evidence.""";

  static final String ANSWER =
      """
      Question: %s

      Evidence:
      %s

      Provide a clear, well-cited answer based on the evidence above.""";

  static final String REGENERATE =
      """
      Answer the following question briefly and directly based on the evidence.

      Question: %s

      Evidence:
      %s

      Provide a concise answer (1-3 sentences).""";

  static final String REWRITE =
      """
      The following query didn't retrieve good results. Generate 3 alternative versions of this \
      query that might retrieve better results. Use synonyms, rephrasings, and different angles.

      Original query: %s

      Return a JSON object:
      - "rewrites": list of 3 alternative query strings""";

  static final String DECOMPOSE =
      """
      Break the following complex question into simpler, independent sub-questions that can be \
      answered individually.
      Return a JSON object with:
      - "sub_questions": list of simple questions (max %d)

      If the question is already simple, return it as the only sub-question.

      Question: %s""";

  static final String GROUNDEDNESS =
      """
      Evaluate how well the following answer to the question is grounded in the provided evidence.
      An answer that does not respond to the question is not grounded, even if its statements \
      appear in the evidence.

      Question: %s

      Answer: %s

      Evidence:
      %s

      For each claim in the answer, determine if it is directly supported by the evidence.
      Return a JSON object:
      - "score": float between 0.0 (not grounded) and 1.0 (fully grounded)
      - "unsupported_claims": list of claims not supported by evidence
      - "admits_ignorance": true if the answer says the evidence does not answer the question""";

  static final String PASSAGE_CONFLICTS =
      """
      Analyze the following passages for contradictions.

      %s

      Identify any factual contradictions between the passages.
      Return a JSON object:
      - "contradictions": list of {"passage_a": int, "passage_b": int, "description": str}""";

  static final String ANSWER_CONFLICTS =
      """
      Does the following answer contradict any of the evidence?

      Answer: %s

      Evidence:
      %s

      Return a JSON object:
      - "contradictions": list of {"claim": str, "evidence_num": int, "description": str}
      - "contradiction_rate": float between 0.0 and 1.0""";
}
