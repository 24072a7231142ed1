package com.ryuqq.analysis.core.exception;

/**
 * (name, version) 또는 (name, contentHash) 유일성 위반.
 *
 * <p>다른 writer가 같은 번호를 먼저 발급한 경우 Registry가 던지며,
 * Transaction Manager는 다음 번호로 재시도합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class VersionCollisionException extends RuntimeException {

    private final String frameworkName;
    private final int version;

    public VersionCollisionException(String frameworkName, int version, String message) {
        super(message);
        this.frameworkName = frameworkName;
        this.version = version;
    }

    public String getFrameworkName() {
        return frameworkName;
    }

    public int getVersion() {
        return version;
    }
}
