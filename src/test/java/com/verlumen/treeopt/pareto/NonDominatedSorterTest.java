package com.verlumen.treeopt.pareto;

import static com.google.common.truth.Truth.assertThat;
import static com.verlumen.treeopt.pareto.ParetoTesting.scored;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class NonDominatedSorterTest {
  @Test
  public void sort_splitsIntoFrontsAndRanksMembers() {
    // Arrange
    ParetoIndividual top = scored(3, 3);
    ParetoIndividual middle = scored(2, 2);
    ParetoIndividual left = scored(3, 1);
    ParetoIndividual right = scored(1, 3);
    ParetoIndividual bottom = scored(1, 1);

    // Act
    ImmutableList<ImmutableList<ParetoIndividual>> fronts =
        NonDominatedSorter.sort(ImmutableList.of(bottom, left, top, right, middle));

    // Assert
    assertThat(fronts).hasSize(3);
    assertThat(fronts.get(0)).containsExactly(top);
    assertThat(fronts.get(1)).containsExactly(left, right, middle);
    assertThat(fronts.get(2)).containsExactly(bottom);
    assertThat(top.rank()).isEqualTo(0);
    assertThat(middle.rank()).isEqualTo(1);
    assertThat(bottom.rank()).isEqualTo(2);
  }

  @Test
  public void sort_mutuallyNonDominated_singleFront() {
    ImmutableList<ParetoIndividual> population =
        ImmutableList.of(scored(1, 4), scored(2, 3), scored(3, 2), scored(4, 1));

    ImmutableList<ImmutableList<ParetoIndividual>> fronts = NonDominatedSorter.sort(population);

    assertThat(fronts).hasSize(1);
    assertThat(fronts.get(0)).containsExactlyElementsIn(population);
  }

  @Test
  public void sort_emptyPopulation_noFronts() {
    assertThat(NonDominatedSorter.sort(ImmutableList.of())).isEmpty();
  }
}
