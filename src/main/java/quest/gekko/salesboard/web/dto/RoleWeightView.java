package quest.gekko.salesboard.web.dto;

import quest.gekko.salesboard.domain.MemberRole;
import quest.gekko.salesboard.domain.WeeklyRoleWeight;

import java.math.BigDecimal;

public record RoleWeightView(int weekIndex, MemberRole role, BigDecimal weightPercentage) {

    public static RoleWeightView from(WeeklyRoleWeight w) {
        return new RoleWeightView(w.getWeekIndex(), w.getRole(), w.getWeightPercentage());
    }
}
