package com.opro.optimization;

public final class OptimizationConstants {

    private OptimizationConstants() {
        // Private constructor to prevent instantiation
    }

    // LLM request purposes
    public static final String PURPOSE_PROPOSAL = "proposal";
    public static final String PURPOSE_GRADING = "grading";

    // Meta-prompt shape
    public static final int EXAMPLES_PER_META_PROMPT = 3;
    public static final String START_TAG = "<Start>";
    public static final String END_TAG = "</Start>";
    public static final String INSTRUCTION_PLACEHOLDER = "<INS>";

    public static final String EVALUATION_SEPARATOR = "\n\n";

    public static final String INITIAL_META_PROMPT_HEADER = """
            Your task is to generate an instruction that will be prepended to a question to guide a language model to solve it correctly.

            The following exemplars show how your instruction should be applied: you replace <INS> in each input with your instruction, then read the input and give an output.

            """;

    public static final String INITIAL_EXAMPLE_TEMPLATE = """
            Problem:
            Q: <INS> %s
            Ground truth answer:
            %s

            """;

    public static final String INITIAL_META_PROMPT_FOOTER = """
            Write %d new instructions that will help solve similar problems correctly. The instruction should be clear, concise, and encourage step-by-step reasoning.
            """;

    public static final String CONTINUATION_META_PROMPT_HEADER = """
            Your task is to generate %d answer starting sentence <Start> to enhance precision in solving diverse grade school math problems. Scores range from 0 to 100 (higher is better). Below are previous starting sentences with their precision scores, sorted ascending.

            """;

    public static final String SCORED_CANDIDATE_LINE = "Precision: %s <Start>%s</Start>\n";

    public static final String CONTINUATION_EXAMPLES_HEADER = """
            Below are exemplar problems. Apply your <Start> sentence at the beginning of the answer.

            """;

    public static final String CONTINUATION_EXAMPLE_LINE = "Problem: %s <Start> Ground truth: %s\n";

    public static final String CONTINUATION_META_PROMPT_FOOTER = """
            Generate %d new starting sentences that strictly adhere to the structure and vocabulary of the top-scoring examples above. The new sentences should be nearly identical to the best ones, to achieve even higher precision.

            """;

    // Structured-output contracts appended to model requests
    public static final String PROPOSAL_OUTPUT_INSTRUCTION = """

            Return only JSON of the form {"totalTexts": "<count>", "texts": ["<candidate>", ...]} with exactly %d entries in "texts".
            """;

    public static final String GRADING_OUTPUT_INSTRUCTION = """

            Solve the problem, then return only JSON of the form {"solve": "<your reasoning>", "answer": <final numeric answer>}.
            """;

    // Stream event types
    public static final String EVENT_STATUS = "status";
    public static final String EVENT_STEP_GENERATED = "step-generated";
    public static final String EVENT_PROMPT_SCORED = "prompt-scored";
    public static final String EVENT_PROMPT_FAILED = "prompt-failed";
    public static final String EVENT_STEP_ADVANCED = "step-advanced";
    public static final String EVENT_RUN_COMPLETE = "run-complete";
    public static final String EVENT_RUN_CANCEL = "run-cancel";
    public static final String EVENT_ERROR = "error";

    public static final String RUN_STATUS_COMPLETED = "COMPLETED";
    public static final String RUN_STATUS_CANCELLED = "CANCELLED";
    public static final String RUN_STATUS_FAILED = "FAILED";
}
