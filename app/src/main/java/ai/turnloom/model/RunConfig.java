package ai.turnloom.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/**
 * How a turn should be executed.
 *
 * @param runner the agent vendor
 * @param modelId the vendor model identifier
 * @param thinkingEffort reasoning effort requested from the model
 * @param ampMode vendor-specific mode string; null when unused
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunConfig(
        @JsonProperty("runner") RunnerKind runner,
        @JsonProperty("model_id") String modelId,
        @JsonProperty("thinking_effort") ThinkingEffort thinkingEffort,
        @JsonProperty("amp_mode") @Nullable String ampMode) {

    public RunConfig {
        if (runner == null) {
            runner = RunnerKind.CODEX;
        }
        if (thinkingEffort == null) {
            thinkingEffort = ThinkingEffort.MEDIUM;
        }
        if (modelId == null) {
            modelId = "";
        }
    }

    public static RunConfig of(RunnerKind runner, String modelId) {
        return new RunConfig(runner, modelId, ThinkingEffort.MEDIUM, null);
    }
}
