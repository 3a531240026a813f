package com.can.ringcache;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;

/**
 * Quarkus uygulaması için giriş noktasıdır. Önbellek kaydı CDI tarafından
 * başlatıldıktan sonra ana thread'i süreç kapanana kadar bekletir.
 */
@QuarkusMain
public class RingCacheApplication implements QuarkusApplication
{
    @Override
    public int run(String... args)
    {
        Quarkus.waitForExit();
        return 0;
    }

    public static void main(String... args)
    {
        Quarkus.run(RingCacheApplication.class, args);
    }
}
