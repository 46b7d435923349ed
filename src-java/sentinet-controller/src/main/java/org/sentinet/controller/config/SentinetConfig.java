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

package org.sentinet.controller.config;

import com.sabre.oss.conf4j.annotation.Configuration;
import com.sabre.oss.conf4j.annotation.Default;
import com.sabre.oss.conf4j.annotation.Description;
import com.sabre.oss.conf4j.annotation.Key;

import java.io.Serializable;
import java.time.Duration;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;

@Configuration
@Key("sentinet")
public interface SentinetConfig extends Serializable {
    @Key("topology.resource")
    @Default("topology.json")
    @NotBlank
    String getTopologyResource();

    @Key("stats.poll-interval-sec")
    @Default("2")
    @DecimalMin(value = "0", inclusive = false)
    @Description("Flow statistics polling interval.")
    double getPollIntervalSec();

    @Key("flow.idle-timeout")
    @Default("30")
    @Min(0)
    @Max(0xffff)
    int getFlowIdleTimeout();

    @Key("flow.hard-timeout")
    @Default("300")
    @Min(0)
    @Max(0xffff)
    int getFlowHardTimeout();

    @Key("flow.navigator-idle-timeout")
    @Default("5")
    @Min(0)
    @Max(0xffff)
    @Description("Idle timeout of rules installed from a navigator path, short so that re-routing takes effect "
               + "quickly.")
    int getNavigatorFlowIdleTimeout();

    @Key("security.alert-cooldown-sec")
    @Default("10")
    @Min(1)
    int getAlertCooldownSec();

    @Key("security.cooldown-sweep-interval-sec")
    @Default("5")
    @Min(1)
    int getCooldownSweepIntervalSec();

    @Key("security.block-duration-sec")
    @Default("60")
    @Min(1)
    @Max(0xffff)
    int getBlockDurationSec();

    @Key("security.pps-threshold")
    @Default("1000")
    @DecimalMin("0")
    double getAttackPpsThreshold();

    @Key("security.bps-threshold")
    @Default("100000")
    @DecimalMin("0")
    double getAttackBpsThreshold();

    @Key("navigator.enabled")
    @Default("true")
    boolean isNavigatorEnabled();

    @Key("navigator.state-path")
    @Description("Where the learned navigator state is kept between runs, empty to disable persistence.")
    String getNavigatorStatePath();

    default Duration getPollInterval() {
        return Duration.ofMillis(Math.round(getPollIntervalSec() * 1000));
    }

    default Duration getAlertCooldown() {
        return Duration.ofSeconds(getAlertCooldownSec());
    }

    default Duration getCooldownSweepInterval() {
        return Duration.ofSeconds(getCooldownSweepIntervalSec());
    }
}
