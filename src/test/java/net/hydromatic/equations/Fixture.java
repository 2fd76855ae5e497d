/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.equations;

import net.hydromatic.equations.ast.Term;
import net.hydromatic.equations.graph.PropertyGraph;

/**
 * The speeding-fine model: a property graph and its leaves.
 *
 * <p>To measure speed you need distance and duration; to compute a fine (in
 * Finland at least) you also need monthly income and the speed limit.
 */
public class Fixture {
  public final PropertyGraph g;
  public final Term i;
  public final Term o;
  public final Term speed;
  public final Term distance;
  public final Term duration;
  public final Term fine;
  public final Term monthlyIncome;
  public final Term speedLimit;
  public final Term smallFine;

  public Fixture() {
    this(new PropertyGraph());
  }

  public Fixture(PropertyGraph g) {
    this.g = g;
    i = g.identity();
    o = g.terminal();
    speed = g.leaf("speed");
    distance = g.leaf("distance");
    duration = g.leaf("duration");
    fine = g.leaf("fine");
    monthlyIncome = g.leaf("monthly_income");
    speedLimit = g.leaf("speed_limit");
    smallFine = g.leaf("small_fine");
  }

  /** Returns {@code speed * (distance + duration)}. */
  public Term speedModel() {
    return speed.times(distance.plus(duration));
  }

  /**
   * Returns {@code speed * (distance + duration) + fine * (speed +
   * monthly_income + speed_limit)}.
   */
  public Term fineModel() {
    return speedModel().plus(fine.times(speed.plus(monthlyIncome, speedLimit)));
  }

  /**
   * Returns {@code fine * (speed * (distance + duration) * O + monthly_income
   * + speed_limit)}, which is equivalent to {@link #fineModel()} when closed
   * on both sides.
   */
  public Term fineModel2() {
    return fine.times(
        speed
            .times(distance.plus(duration), o)
            .plus(monthlyIncome, speedLimit));
  }

  /**
   * Returns {@code fine * (speed * (distance + duration) * O + monthly_income
   * + speed_limit) + small_fine * speed * (distance + duration) * O}; small
   * fines do not need monthly income.
   */
  public Term smallFineModel() {
    return fineModel2()
        .plus(smallFine.times(speed, distance.plus(duration), o));
  }

  /**
   * Returns {@code (fine * (I + monthly_income * O + speed_limit * O) +
   * small_fine) * speed * (distance + duration)}, the same model written as if
   * fine and small fine inherited from a common base class.
   */
  public Term baseClassModel() {
    return fine.times(i.plus(monthlyIncome.times(o), speedLimit.times(o)))
        .plus(smallFine)
        .times(speed, distance.plus(duration));
  }
}

// End Fixture.java
