package io.hostforge.provisioner.service;

import io.hostforge.provisioner.model.ConnectionRecord;
import io.hostforge.provisioner.model.ErrorEntry;

import java.util.List;

/**
 * Read-only summary of a host's hardening progress.
 *
 * @param nextStep   null once every step is done
 * @param sshCommand how to log in with the last verified access path (null if none yet)
 */
public record HardeningStatus(
        String           hostIdentifier,
        String           hostAddress,
        String           currentPhase,
        List<String>     completedSteps,
        List<String>     skippedSteps,
        int              totalSteps,
        int              percentage,
        String           nextStep,
        boolean          resumable,
        ConnectionRecord connection,
        ErrorEntry       lastError,
        String           sshCommand) {}
