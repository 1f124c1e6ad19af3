package quest.gekko.salesboard.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import quest.gekko.salesboard.domain.MemberRole;
import quest.gekko.salesboard.service.core.CategoryService;
import quest.gekko.salesboard.service.core.MembershipService;
import quest.gekko.salesboard.service.core.PeriodService;
import quest.gekko.salesboard.service.validation.ValidationException;
import quest.gekko.salesboard.web.dto.CategoryView;
import quest.gekko.salesboard.web.dto.MembershipView;
import quest.gekko.salesboard.web.dto.PeriodView;
import quest.gekko.salesboard.web.dto.Requests;

import java.util.List;

@RestController
@RequestMapping("/api/v1/shops/{shopId}")
@RequiredArgsConstructor
public class ShopController {
    private final PeriodService periodService;
    private final MembershipService membershipService;
    private final CategoryService categoryService;

    @PostMapping("/periods")
    @ResponseStatus(HttpStatus.CREATED)
    public PeriodView createPeriod(@PathVariable String shopId, @RequestBody Requests.CreatePeriod body) {
        if (body.year() == null || body.month() == null) {
            throw ValidationException.of("year/month", "shop=" + shopId, "year and month are required");
        }
        return PeriodView.from(periodService.createPeriod(shopId, body.year(), body.month()));
    }

    @GetMapping("/periods")
    public List<PeriodView> listPeriods(@PathVariable String shopId) {
        return periodService.listPeriods(shopId).stream().map(PeriodView::from).toList();
    }

    @PutMapping("/members/{userId}")
    public MembershipView upsertMember(@PathVariable String shopId, @PathVariable String userId,
                                       @RequestBody Requests.Membership body) {
        MemberRole role = body.role();
        if (role == null) {
            throw ValidationException.of("role", "shop=" + shopId + ",user=" + userId, "role is required");
        }
        boolean active = body.active() == null || body.active();
        return MembershipView.from(membershipService.upsertMembership(shopId, userId, role, active));
    }

    @GetMapping("/members")
    public List<MembershipView> members(@PathVariable String shopId) {
        return membershipService.members(shopId).stream().map(MembershipView::from).toList();
    }

    @PostMapping("/categories")
    @ResponseStatus(HttpStatus.CREATED)
    public CategoryView createCategory(@PathVariable String shopId, @RequestBody Requests.CreateCategory body) {
        return CategoryView.from(categoryService.createCategory(shopId, body.name(), body.unit(), body.sortOrder()));
    }

    @GetMapping("/categories")
    public List<CategoryView> categories(@PathVariable String shopId) {
        return categoryService.categories(shopId).stream().map(CategoryView::from).toList();
    }
}
