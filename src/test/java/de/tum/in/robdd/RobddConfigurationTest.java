/*
 * This file is part of JROBDD.
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * JROBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JROBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JROBDD. If not, see <http://www.gnu.org/licenses/>.
 */

package de.tum.in.robdd;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class RobddConfigurationTest {
    @Test
    public void testDefaults() {
        RobddConfiguration configuration = RobddConfiguration.defaults();
        assertThat(configuration.initialTableSize(), is(RobddConfiguration.DEFAULT_INITIAL_TABLE_SIZE));
        assertThat(configuration.initialMemoSize(), is(RobddConfiguration.DEFAULT_INITIAL_MEMO_SIZE));
        assertThat(configuration.growthFactor(), is(RobddConfiguration.DEFAULT_GROWTH_FACTOR));
        assertThat(configuration.checkInvariants(), is(false));
        assertThat(configuration.logStatisticsOnShutdown(), is(false));
        assertThat(RobddFactory.create().configuration(), is(configuration));
    }

    @Test
    public void testInvalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> ImmutableRobddConfiguration.builder().growthFactor(1.0d).build());
        assertThrows(IllegalArgumentException.class,
                () -> ImmutableRobddConfiguration.builder().initialTableSize(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> ImmutableRobddConfiguration.builder().initialMemoSize(-3).build());
    }

    @Test
    public void testSmallTablesGrow() {
        RobddFactory factory = RobddFactory.create(ImmutableRobddConfiguration.builder()
                .initialTableSize(1)
                .initialMemoSize(1)
                .growthFactor(1.01d)
                .build());

        Robdd parity = factory.makeFalse();
        for (int variable = 0; variable < 40; variable++) {
            parity = parity.xor(factory.makeVar(variable));
        }
        assertThat(parity.nodeCount(), is(79));
        assertThat(parity.check(), is(true));
        assertThat(parity.evaluate(v -> v < 3), is(true));
        assertThat(parity.evaluate(v -> v < 4), is(false));
    }

    @Test
    public void testShutdownStatistics() {
        RobddFactory factory = RobddFactory.create(
                ImmutableRobddConfiguration.builder().logStatisticsOnShutdown(true).build());
        factory.makeVar(1).or(factory.makeVar(2));
        // Printed by the shutdown hook
        assertThat(factory.statistics().contains("apply=1"), is(true));
    }
}
