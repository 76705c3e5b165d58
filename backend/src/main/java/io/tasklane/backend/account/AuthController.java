package io.tasklane.backend.account;

import io.tasklane.backend.api.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Public account endpoints: registration and sign-in. */
@RestController
@RequestMapping("/api/auth")
public class AuthController {

  private final AccountService accountService;

  public AuthController(AccountService accountService) {
    this.accountService = accountService;
  }

  @PostMapping("/signup")
  public ResponseEntity<ApiResponse<SignUpResponse>> signUp(
      @Valid @RequestBody SignUpRequest request) {
    var user = accountService.signUp(request.email(), request.password(), request.name());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(ApiResponse.ok(new SignUpResponse("User created successfully", user.getId())));
  }

  @PostMapping("/signin")
  public ResponseEntity<ApiResponse<TokenResponse>> signIn(
      @Valid @RequestBody SignInRequest request) {
    var result = accountService.signIn(request.email(), request.password());
    var user = result.user();
    return ResponseEntity.ok(
        ApiResponse.ok(
            new TokenResponse(
                result.accessToken(),
                "bearer",
                new UserResponse(user.getId(), user.getEmail(), user.getName()))));
  }

  public record SignUpRequest(
      @NotBlank(message = "email is required")
          @Email(message = "email must be a valid email address")
          @Size(max = 320, message = "email must be at most 320 characters")
          String email,
      @NotBlank(message = "password is required")
          @Size(min = 8, max = 72, message = "password must be 8 to 72 characters")
          String password,
      @NotBlank(message = "name is required")
          @Size(max = 100, message = "name must be at most 100 characters")
          String name) {}

  public record SignInRequest(
      @NotBlank(message = "email is required") String email,
      @NotBlank(message = "password is required") String password) {}

  public record SignUpResponse(String message, UUID userId) {}

  public record TokenResponse(String accessToken, String tokenType, UserResponse user) {}

  public record UserResponse(UUID id, String email, String name) {}
}
