package com.tenantseed.model.fixture;

/**
 * One genotyped locus. Health loci carry a status string as genotype and no alleles.
 */
public record LocusFixture(
    String locus,
    String locusName,
    String allele1,
    String allele2,
    String genotype
) {
}
