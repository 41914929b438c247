package txt2tex.pipeline;

/** Outcome of {@link Pipeline#run}: either the LaTeX text or the first error met. */
public sealed interface PipelineResult permits PipelineResult.Ok, PipelineResult.Err {

    record Ok(String latex) implements PipelineResult {}

    record Err(StageError error) implements PipelineResult {}

    default boolean isOk() {
        return this instanceof Ok;
    }
}
