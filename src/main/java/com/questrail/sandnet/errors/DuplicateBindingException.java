package com.questrail.sandnet.errors;

/**
 * The local tuple is already bound by this layer (a listener owns it, or the
 * transport already has an identical connection tuple).
 */
public final class DuplicateBindingException extends PortConflictException
{
    public DuplicateBindingException(String message) {
        super(message);
    }
}
