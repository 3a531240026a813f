package com.can.ringcache.cluster;

/**
 * Tutarlı hash halkasında düğüm ve anahtar yerleşimini belirleyen hash
 * fonksiyonlarının sözleşmesidir. Tek gereksinim, baytları 64 bitlik halka
 * koordinat uzayına tekdüze ve deterministik şekilde eşlemesidir.
 */
@FunctionalInterface
public interface HashFn
{
    long hash(byte[] bytes);
}
