package io.agentmesh.barrier;

/**
 * Result of holding a session at its completion point.
 *
 * @param resumePrompt text the host should resume the session with; set only for {@link Kind#RESUME}
 */
public record BarrierOutcome(
        Kind kind,
        String resumePrompt,
        int iterations
) {
    public enum Kind {
        SATISFIED,
        RESUME,
        ABORTED
    }

    public static BarrierOutcome satisfied(int iterations) {
        return new BarrierOutcome(Kind.SATISFIED, null, iterations);
    }

    public static BarrierOutcome resume(String prompt, int iterations) {
        return new BarrierOutcome(Kind.RESUME, prompt, iterations);
    }

    public static BarrierOutcome aborted(int iterations) {
        return new BarrierOutcome(Kind.ABORTED, null, iterations);
    }

    public boolean mayComplete() {
        return kind != Kind.RESUME;
    }
}
