package com.can.ringcache.backend;

/**
 * Bir önbellek işleminin gerçekten başarısız olduğunu bildirir. Anahtarın
 * bulunamaması bu istisnayla değil, boş sonuçla ifade edilir.
 */
public class CacheOperationException extends RuntimeException
{
    public enum Kind
    {
        INVALID_ARGUMENT,
        BACKEND_FAILURE,
        TIMEOUT,
        CONSISTENCY_NOT_MET,
        NO_NODES_AVAILABLE,
        NOT_CONNECTED
    }

    private final Kind kind;

    public CacheOperationException(Kind kind, String message)
    {
        super(message);
        this.kind = kind;
    }

    public CacheOperationException(Kind kind, String message, Throwable cause)
    {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind()
    {
        return kind;
    }
}
