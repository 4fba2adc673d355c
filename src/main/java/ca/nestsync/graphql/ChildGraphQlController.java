package ca.nestsync.graphql;

import ca.nestsync.dto.request.CreateChildInput;
import ca.nestsync.dto.request.UpdateChildInput;
import ca.nestsync.dto.response.ChildResponse;
import ca.nestsync.dto.response.ChildView;
import ca.nestsync.dto.response.Connection;
import ca.nestsync.dto.response.MutationResponse;
import ca.nestsync.dto.response.OnboardingStatus;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.service.ChildService;
import ca.nestsync.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

import java.util.UUID;

@Controller
@RequiredArgsConstructor
public class ChildGraphQlController {

    private final ChildService childService;
    private final UserService userService;

    @QueryMapping
    public Connection<ChildView> myChildren(@Argument Integer first, @Argument String after) {
        return childService.getMyChildren(userService.requireCurrentUser(), first != null ? first : 10, after);
    }

    @QueryMapping
    public ChildView child(@Argument UUID id) {
        return childService.getChild(id, userService.requireCurrentUser());
    }

    @QueryMapping
    public OnboardingStatus onboardingStatus() {
        return childService.getOnboardingStatus(userService.requireCurrentUser());
    }

    @MutationMapping
    public ChildResponse createChild(@Argument @Valid CreateChildInput input) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(
                () -> ChildResponse.ok(childService.createChild(user, input), "Child profile created successfully"),
                ChildResponse::failure);
    }

    @MutationMapping
    public ChildResponse updateChild(@Argument UUID id, @Argument @Valid UpdateChildInput input) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(
                () -> ChildResponse.ok(childService.updateChild(id, user, input), "Child profile updated successfully"),
                ChildResponse::failure);
    }

    @MutationMapping
    public MutationResponse deleteChild(@Argument UUID id) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(() -> {
            childService.deleteChild(id, user);
            return MutationResponse.ok("Child profile deleted successfully");
        }, MutationResponse::failure);
    }
}
