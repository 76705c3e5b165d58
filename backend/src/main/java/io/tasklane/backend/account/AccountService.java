package io.tasklane.backend.account;

import io.tasklane.backend.security.AccessTokenService;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AccountService {

  private static final Logger log = LoggerFactory.getLogger(AccountService.class);

  private final AppUserRepository appUserRepository;
  private final PasswordEncoder passwordEncoder;
  private final AccessTokenService accessTokenService;

  public AccountService(
      AppUserRepository appUserRepository,
      PasswordEncoder passwordEncoder,
      AccessTokenService accessTokenService) {
    this.appUserRepository = appUserRepository;
    this.passwordEncoder = passwordEncoder;
    this.accessTokenService = accessTokenService;
  }

  /** Result of a successful sign-in. */
  public record SignInResult(String accessToken, AppUser user) {}

  /**
   * Registers a user. Emails are compared case-insensitively and stored lower-case.
   *
   * @throws DuplicateEmailException if the email is already registered
   */
  @Transactional
  public AppUser signUp(String email, String password, String name) {
    String normalizedEmail = normalizeEmail(email);
    if (appUserRepository.existsByEmail(normalizedEmail)) {
      throw new DuplicateEmailException();
    }

    var user = new AppUser(normalizedEmail, name.strip(), passwordEncoder.encode(password));
    try {
      user = appUserRepository.saveAndFlush(user);
    } catch (DataIntegrityViolationException e) {
      // Lost a race with a concurrent sign-up for the same email
      throw new DuplicateEmailException();
    }
    log.info("Registered user {}", user.getId());
    return user;
  }

  /**
   * Checks credentials and issues an access token.
   *
   * @throws InvalidCredentialsException for an unknown email or a wrong password
   */
  @Transactional(readOnly = true)
  public SignInResult signIn(String email, String password) {
    var user =
        appUserRepository
            .findByEmail(normalizeEmail(email))
            .orElseThrow(InvalidCredentialsException::new);

    if (!passwordEncoder.matches(password, user.getPasswordHash())) {
      log.debug("Sign-in rejected for user {}", user.getId());
      throw new InvalidCredentialsException();
    }

    String token = accessTokenService.issueToken(user.getId(), user.getEmail(), user.getName());
    log.info("User {} signed in", user.getId());
    return new SignInResult(token, user);
  }

  private static String normalizeEmail(String email) {
    return email.strip().toLowerCase(Locale.ROOT);
  }
}
