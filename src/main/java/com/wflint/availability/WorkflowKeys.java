package com.wflint.availability;

import java.util.List;

/**
 * Every workflow location where an expression may appear.
 * <p>
 * Keys follow the path notation of the workflow syntax reference, with
 * {@code <placeholder>} segments standing for user-chosen map keys.
 * The availability data must cover exactly this set.
 */
public final class WorkflowKeys {

    private WorkflowKeys() {
    }

    public static final String RUN_NAME = "run-name";
    public static final String CONCURRENCY = "concurrency";
    public static final String ENV = "env";

    public static final String WORKFLOW_CALL_INPUT_DEFAULT = "on.workflow_call.inputs.<inputs_id>.default";
    public static final String WORKFLOW_CALL_OUTPUT_VALUE = "on.workflow_call.outputs.<output_id>.value";

    public static final String JOB_CONCURRENCY = "jobs.<job_id>.concurrency";
    public static final String JOB_CONTAINER = "jobs.<job_id>.container";
    public static final String JOB_CONTAINER_CREDENTIALS = "jobs.<job_id>.container.credentials";
    public static final String JOB_CONTAINER_ENV = "jobs.<job_id>.container.env.<env_id>";
    public static final String JOB_CONTAINER_IMAGE = "jobs.<job_id>.container.image";
    public static final String JOB_CONTINUE_ON_ERROR = "jobs.<job_id>.continue-on-error";
    public static final String JOB_DEFAULTS_RUN = "jobs.<job_id>.defaults.run";
    public static final String JOB_ENV = "jobs.<job_id>.env";
    public static final String JOB_ENVIRONMENT = "jobs.<job_id>.environment";
    public static final String JOB_ENVIRONMENT_URL = "jobs.<job_id>.environment.url";
    public static final String JOB_IF = "jobs.<job_id>.if";
    public static final String JOB_NAME = "jobs.<job_id>.name";
    public static final String JOB_OUTPUTS = "jobs.<job_id>.outputs.<output_id>";
    public static final String JOB_RUNS_ON = "jobs.<job_id>.runs-on";
    public static final String JOB_SECRETS = "jobs.<job_id>.secrets.<secrets_id>";
    public static final String JOB_SERVICES = "jobs.<job_id>.services";
    public static final String JOB_SERVICE_CREDENTIALS = "jobs.<job_id>.services.<service_id>.credentials";
    public static final String JOB_SERVICE_ENV = "jobs.<job_id>.services.<service_id>.env.<env_id>";
    public static final String JOB_STRATEGY = "jobs.<job_id>.strategy";
    public static final String JOB_TIMEOUT_MINUTES = "jobs.<job_id>.timeout-minutes";
    public static final String JOB_WITH = "jobs.<job_id>.with.<with_id>";

    public static final String STEP_CONTINUE_ON_ERROR = "jobs.<job_id>.steps.continue-on-error";
    public static final String STEP_ENV = "jobs.<job_id>.steps.env";
    public static final String STEP_IF = "jobs.<job_id>.steps.if";
    public static final String STEP_NAME = "jobs.<job_id>.steps.name";
    public static final String STEP_RUN = "jobs.<job_id>.steps.run";
    public static final String STEP_TIMEOUT_MINUTES = "jobs.<job_id>.steps.timeout-minutes";
    public static final String STEP_WITH = "jobs.<job_id>.steps.with";
    public static final String STEP_WORKING_DIRECTORY = "jobs.<job_id>.steps.working-directory";

    public static final List<String> ALL = List.of(
            RUN_NAME,
            CONCURRENCY,
            ENV,
            WORKFLOW_CALL_INPUT_DEFAULT,
            WORKFLOW_CALL_OUTPUT_VALUE,
            JOB_CONCURRENCY,
            JOB_CONTAINER,
            JOB_CONTAINER_CREDENTIALS,
            JOB_CONTAINER_ENV,
            JOB_CONTAINER_IMAGE,
            JOB_CONTINUE_ON_ERROR,
            JOB_DEFAULTS_RUN,
            JOB_ENV,
            JOB_ENVIRONMENT,
            JOB_ENVIRONMENT_URL,
            JOB_IF,
            JOB_NAME,
            JOB_OUTPUTS,
            JOB_RUNS_ON,
            JOB_SECRETS,
            JOB_SERVICES,
            JOB_SERVICE_CREDENTIALS,
            JOB_SERVICE_ENV,
            JOB_STRATEGY,
            JOB_TIMEOUT_MINUTES,
            JOB_WITH,
            STEP_CONTINUE_ON_ERROR,
            STEP_ENV,
            STEP_IF,
            STEP_NAME,
            STEP_RUN,
            STEP_TIMEOUT_MINUTES,
            STEP_WITH,
            STEP_WORKING_DIRECTORY
    );
}
