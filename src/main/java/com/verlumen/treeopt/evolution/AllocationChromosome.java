package com.verlumen.treeopt.evolution;

import com.verlumen.treeopt.model.Allocation;
import io.jenetics.AbstractChromosome;
import io.jenetics.Chromosome;
import io.jenetics.Genotype;
import io.jenetics.Phenotype;
import io.jenetics.util.ISeq;

/** Chromosome of exactly one {@link AllocationGene}. */
public final class AllocationChromosome extends AbstractChromosome<AllocationGene> {
  private AllocationChromosome(ISeq<? extends AllocationGene> genes) {
    super(genes);
  }

  public static AllocationChromosome of(AllocationGene gene) {
    return new AllocationChromosome(ISeq.of(gene));
  }

  public static Genotype<AllocationGene> genotype(AllocationGene gene) {
    return Genotype.of(of(gene));
  }

  /** The gene behind a phenotype of this project's engines. */
  public static AllocationGene geneOf(Phenotype<AllocationGene, ?> phenotype) {
    return phenotype.genotype().gene();
  }

  public static Allocation allocationOf(Phenotype<AllocationGene, ?> phenotype) {
    return geneOf(phenotype).allele();
  }

  @Override
  public Chromosome<AllocationGene> newInstance(ISeq<AllocationGene> genes) {
    return new AllocationChromosome(genes);
  }

  @Override
  public Chromosome<AllocationGene> newInstance() {
    return of(gene().newInstance());
  }
}
