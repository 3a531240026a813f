package com.can.ringcache.cluster;

import java.util.Locale;

/**
 * Dynamo tarzı ayarlanabilir tutarlılık seviyeleri. Bir okuma ya da yazmanın
 * başarılı sayılması için kaç replikanın yanıt vermesi gerektiğini belirler.
 */
public enum ConsistencyLevel
{
    ONE,
    QUORUM,
    ALL;

    /**
     * Number of replicas that must answer out of {@code replicas}.
     */
    public int required(int replicas)
    {
        if (replicas <= 0) {
            return 0;
        }
        return switch (this) {
            case ONE -> 1;
            case QUORUM -> majority(replicas);
            case ALL -> replicas;
        };
    }

    public static int majority(int replicas)
    {
        return (replicas / 2) + 1;
    }

    public String configName()
    {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConsistencyLevel fromConfig(String value)
    {
        if (value == null || value.isBlank()) return ONE;
        try {
            return ConsistencyLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown consistency level: " + value, ex);
        }
    }
}
