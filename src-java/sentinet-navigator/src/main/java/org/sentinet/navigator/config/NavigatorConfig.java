/* Copyright 2023 Telstra Open Source
 *
 *   Licensed under the Apache License, Version 2.0 (the "License");
 *   you may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */

package org.sentinet.navigator.config;

import com.sabre.oss.conf4j.annotation.Configuration;
import com.sabre.oss.conf4j.annotation.Default;
import com.sabre.oss.conf4j.annotation.Description;
import com.sabre.oss.conf4j.annotation.Key;

import java.io.Serializable;
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;

/**
 * Q-learning hyper parameters and scoring constants.
 */
@Configuration
@Key("sentinet.navigator")
public interface NavigatorConfig extends Serializable {
    @Key("alpha")
    @Default("0.1")
    @DecimalMin("0")
    @DecimalMax("1")
    @Description("Learning rate.")
    double getAlpha();

    @Key("gamma")
    @Default("0.9")
    @DecimalMin("0")
    @DecimalMax("1")
    @Description("Discount factor.")
    double getGamma();

    @Key("epsilon")
    @Default("0.1")
    @DecimalMin("0")
    @DecimalMax("1")
    @Description("Exploration probability at start.")
    double getEpsilon();

    @Key("epsilon-decay")
    @Default("0.995")
    @DecimalMin("0")
    @DecimalMax("1")
    double getEpsilonDecay();

    @Key("epsilon-min")
    @Default("0.01")
    @DecimalMin("0")
    @DecimalMax("1")
    double getEpsilonMin();

    @Key("congestion-penalty-scale")
    @Default("100")
    @DecimalMin("0")
    double getCongestionPenaltyScale();

    @Key("weight-penalty-factor")
    @Default("1.0")
    @DecimalMin("0")
    @Description("Share of the edge weight subtracted from the action score. Together with the destination bonus "
               + "it decides whether a saturated direct link still beats a longer idle detour.")
    double getWeightPenaltyFactor();

    @Key("destination-bonus")
    @Default("10")
    @DecimalMin("0")
    double getDestinationBonus();

    @Key("reward-congestion-factor")
    @Default("50")
    @DecimalMin("0")
    @Description("Multiplier of the summed congestion in the path reward.")
    double getRewardCongestionFactor();

    @Key("initial-jitter")
    @Default("0.1")
    @DecimalMin("0")
    @Description("Upper bound of the random jitter added to the initial action values.")
    double getInitialJitter();
}
