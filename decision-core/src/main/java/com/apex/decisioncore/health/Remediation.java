package com.apex.decisioncore.health;

/**
 * Corrective action attached to a check. A thrown exception marks the attempt as failed.
 */
@FunctionalInterface
public interface Remediation {

    /**
     * @return short description of what was done
     */
    String run() throws Exception;
}
