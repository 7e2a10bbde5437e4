package org.example.escrowpaymentservice.core.exception;

public class AgentNotProvisionedException extends RuntimeException {
    public AgentNotProvisionedException(String msg) {super(msg);}
}
