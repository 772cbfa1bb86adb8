package com.autonomous.analysis.prompt;

import com.autonomous.analysis.model.RoleDefinition;
import com.autonomous.analysis.model.TaskInput;

/**
 * Builds the user prompt for one attempt of a role. Implementations are Spring beans and are
 * referenced from role definitions by bean name.
 */
@FunctionalInterface
public interface PromptAssembler {

    String assemble(RoleDefinition role, TaskInput input);
}
